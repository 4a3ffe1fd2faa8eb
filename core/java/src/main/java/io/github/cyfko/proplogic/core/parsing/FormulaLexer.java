package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.exception.FormulaLexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass, pull-based tokenizer for the formula notation.
 * <p>
 * The lexer keeps an explicit cursor into the input and produces one {@link Token} per call to
 * {@link #next()}. Tokens are produced lazily, so a lexical error located after a grammar error
 * is never reported: the parser fails first.
 * </p>
 *
 * <p><strong>Token rules:</strong></p>
 * <ul>
 *   <li>{@code ~ & | ( )} are single-character tokens</li>
 *   <li>{@code ->} and {@code <->} are read character by character; any other continuation is an
 *       unexpected character, and running out of input is an unexpected end of input</li>
 *   <li>an identifier starts with a letter or {@code _} and greedily takes letters, digits and
 *       {@code _}; letters and digits are whole code points, so supplementary characters such
 *       as {@code U+1D45D} are accepted</li>
 *   <li>{@code ' ', '\t', '\f', '\r', '\n'} are skipped</li>
 *   <li>anything else is an unexpected character</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FormulaLexer lexer = new FormulaLexer("p <-> ~q");
 * for (Token t = lexer.next(); t != null; t = lexer.next()) {
 *     // IDENT "p", IFF "<->", NOT "~", IDENT "q"
 * }
 * }</pre>
 *
 * <p>Positions are UTF-16 offsets into the input, as used by {@link String#substring(int)}.
 * Instances are not thread-safe and cannot be restarted.</p>
 *
 * @author PropLogic Team
 * @since 1.0.0
 */
public final class FormulaLexer {

    private final String input;
    private int pos;

    public FormulaLexer(String input) {
        this.input = Objects.requireNonNull(input, "Input cannot be null");
    }

    /**
     * Reads every remaining token of {@code input}.
     *
     * @param input the text to tokenize
     * @return all tokens in order
     * @throws FormulaLexException on the first lexical error
     */
    public static List<Token> tokenize(String input) {
        FormulaLexer lexer = new FormulaLexer(input);
        List<Token> tokens = new ArrayList<>();
        for (Token token = lexer.next(); token != null; token = lexer.next()) {
            tokens.add(token);
        }
        return tokens;
    }

    /**
     * Advances to the next token.
     *
     * @return the next token, or {@code null} once the input is exhausted
     * @throws FormulaLexException if the input contains an invalid character or ends inside an
     *                             operator
     */
    public Token next() {
        while (pos < input.length()) {
            int start = pos;
            int c = input.codePointAt(pos);
            pos += Character.charCount(c);

            if (isWhitespace(c)) {
                continue;
            }

            switch (c) {
                case '~' -> {
                    return new Token(TokenType.NOT, "~", start);
                }
                case '&' -> {
                    return new Token(TokenType.AND, "&", start);
                }
                case '|' -> {
                    return new Token(TokenType.OR, "|", start);
                }
                case '(' -> {
                    return new Token(TokenType.LPAREN, "(", start);
                }
                case ')' -> {
                    return new Token(TokenType.RPAREN, ")", start);
                }
                case '-' -> {
                    accept('>');
                    return new Token(TokenType.IMPLIES, "->", start);
                }
                case '<' -> {
                    accept('-');
                    accept('>');
                    return new Token(TokenType.IFF, "<->", start);
                }
                default -> {
                    if (isIdentifierStart(c)) {
                        while (pos < input.length()) {
                            int part = input.codePointAt(pos);
                            if (!isIdentifierPart(part)) {
                                break;
                            }
                            pos += Character.charCount(part);
                        }
                        return new Token(TokenType.IDENT, input.substring(start, pos), start);
                    }
                    throw FormulaLexException.unexpectedCharacter(c, start);
                }
            }
        }
        return null;
    }

    /**
     * Tells whether {@code c} is one of the separators the lexer skips.
     * <p>
     * Only {@code ' ', '\t', '\f', '\r', '\n'} qualify. Other Unicode spaces such as
     * {@code U+2003} are unexpected characters.
     * </p>
     *
     * @param c a code point
     * @return {@code true} if the lexer skips {@code c}
     */
    public static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\r' || c == '\n';
    }

    private void accept(char expected) {
        if (pos >= input.length()) {
            throw FormulaLexException.unexpectedEndOfInput(pos);
        }
        int c = input.codePointAt(pos);
        if (c != expected) {
            throw FormulaLexException.unexpectedCharacter(c, pos);
        }
        pos++;
    }

    private static boolean isIdentifierStart(int c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
