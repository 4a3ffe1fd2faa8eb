package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.parsing.FormulaLexer;

/**
 * Exception thrown by the {@link FormulaLexer} when the input text cannot be split into tokens.
 * <p>
 * Two situations are distinguished through {@link #getReason()}:
 * </p>
 * <ul>
 *   <li>{@link Reason#UNEXPECTED_CHARACTER}: a character matches no token rule, or a
 *       multi-character operator ({@code ->}, {@code <->}) continues with the wrong character.
 *       The offending character is available from {@link #getCharacter()}.</li>
 *   <li>{@link Reason#UNEXPECTED_END_OF_INPUT}: the input ended in the middle of a
 *       multi-character operator, e.g. {@code "p -"} or {@code "p <-"}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class FormulaLexException extends FormulaSyntaxException {

    public enum Reason {
        UNEXPECTED_CHARACTER,
        UNEXPECTED_END_OF_INPUT
    }

    private final Reason reason;
    private final int codePoint;

    private FormulaLexException(String message, Reason reason, int codePoint, int position) {
        super(message, position);
        this.reason = reason;
        this.codePoint = codePoint;
    }

    /**
     * Creates the exception for a character that no token rule accepts.
     *
     * @param codePoint the offending character, as a full code point
     * @param position  zero-based offset of {@code codePoint} in the input
     * @return the exception, ready to be thrown
     */
    public static FormulaLexException unexpectedCharacter(int codePoint, int position) {
        String message = at("unexpected character '" + Character.toString(codePoint) + "'", position);
        return new FormulaLexException(message, Reason.UNEXPECTED_CHARACTER, codePoint, position);
    }

    /**
     * Creates the exception for input that stops inside a multi-character operator.
     *
     * @param position the input length, i.e. where another character was expected
     * @return the exception, ready to be thrown
     */
    public static FormulaLexException unexpectedEndOfInput(int position) {
        return new FormulaLexException(at("unexpected end of string", position),
                Reason.UNEXPECTED_END_OF_INPUT, -1, position);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the offending character as a string. A supplementary character is returned whole,
     * so the result may hold two UTF-16 units.
     *
     * @return the offending character, or {@code null} for {@link Reason#UNEXPECTED_END_OF_INPUT}
     */
    public String getCharacter() {
        return codePoint < 0 ? null : Character.toString(codePoint);
    }

    /**
     * @return the offending code point, or {@code -1} for {@link Reason#UNEXPECTED_END_OF_INPUT}
     */
    public int getCodePoint() {
        return codePoint;
    }
}
