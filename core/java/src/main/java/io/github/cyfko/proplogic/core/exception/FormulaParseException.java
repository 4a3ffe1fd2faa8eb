package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.parsing.RecursiveDescentParser;

/**
 * Exception thrown by the {@link RecursiveDescentParser} when a well-formed token stream
 * does not match the formula grammar.
 * <p>
 * Two situations are distinguished through {@link #getReason()}:
 * </p>
 * <ul>
 *   <li>{@link Reason#UNEXPECTED_TOKEN}: a token appears where the grammar forbids it, such as a
 *       stray {@code )}, a binary operator without a left operand, or trailing tokens after a
 *       complete formula. The token text is available from {@link #getLexeme()}.</li>
 *   <li>{@link Reason#UNEXPECTED_END_OF_INPUT}: the token stream ended while an operand or a
 *       closing parenthesis was still required. Empty and blank text fail this way.</li>
 * </ul>
 *
 * <pre>{@code
 * parser.parse("(p & q");   // UNEXPECTED_END_OF_INPUT
 * parser.parse("& p");      // UNEXPECTED_TOKEN, lexeme "&"
 * parser.parse("p q");      // UNEXPECTED_TOKEN, lexeme "q"
 * }</pre>
 *
 * @since 1.0.0
 */
public class FormulaParseException extends FormulaSyntaxException {

    public enum Reason {
        UNEXPECTED_TOKEN,
        UNEXPECTED_END_OF_INPUT
    }

    private final Reason reason;
    private final String lexeme;

    private FormulaParseException(String message, Reason reason, String lexeme, int position) {
        super(message, position);
        this.reason = reason;
        this.lexeme = lexeme;
    }

    /**
     * Creates the exception for a token the grammar does not allow at this point.
     *
     * @param lexeme   the text of the offending token
     * @param position zero-based offset of the token in the input
     * @return the exception, ready to be thrown
     */
    public static FormulaParseException unexpectedToken(String lexeme, int position) {
        return new FormulaParseException(at("unexpected token '" + lexeme + "'", position),
                Reason.UNEXPECTED_TOKEN, lexeme, position);
    }

    /**
     * Creates the exception for a token stream that ended too early.
     *
     * @param position the input length
     * @return the exception, ready to be thrown
     */
    public static FormulaParseException unexpectedEndOfInput(int position) {
        return new FormulaParseException(at("unexpected end of string", position),
                Reason.UNEXPECTED_END_OF_INPUT, null, position);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the offending token text, or {@code null} for {@link Reason#UNEXPECTED_END_OF_INPUT}
     */
    public String getLexeme() {
        return lexeme;
    }
}
