package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.api.FormulaParser;
import io.github.cyfko.proplogic.core.impl.BasicFormulaParser;

/**
 * Exception thrown when formula text cannot be turned into a formula tree.
 * <p>
 * This is the common supertype of every failure raised while reading the textual notation:
 * lexical errors ({@link FormulaLexException}), grammar errors ({@link FormulaParseException})
 * and violations of the configured parser limits (expression too long, nesting too deep).
 * A parse that fails never returns a partial tree.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * // 1. Unknown character (lexical)
 * parser.parse("p $ q");
 * // → "unexpected character '$' at position 2"
 *
 * // 2. Truncated operator (lexical)
 * parser.parse("p -");
 * // → "unexpected end of string at position 3"
 *
 * // 3. Stray closing parenthesis (grammar)
 * parser.parse("p)");
 * // → "unexpected token ')' at position 1"
 *
 * // 4. Policy limit
 * strictParser.parse("p & ".repeat(500) + "p");
 * // → "Expression too long (2001 characters, max: 1000). Policy applied: STRICT_POLICY"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     Formula formula = parser.parse(userInput);
 * } catch (FormulaSyntaxException e) {
 *     log.warning("Rejected formula '" + userInput + "': " + e.getMessage());
 *     highlight(userInput, e.getPosition());
 * }
 * }</pre>
 *
 * @author PropLogic Team
 * @since 1.0.0
 * @see FormulaParser
 * @see BasicFormulaParser
 */
public class FormulaSyntaxException extends RuntimeException {

    /**
     * Position value used when the failure is not tied to a character offset.
     */
    public static final int UNKNOWN_POSITION = -1;

    private final int position;

    /**
     * Constructor with an explanatory error message and no known position.
     *
     * @param message the message describing the cause of the exception
     */
    public FormulaSyntaxException(String message) {
        this(message, UNKNOWN_POSITION);
    }

    /**
     * Constructor with an explanatory error message and the offset where the error was detected.
     *
     * @param message  the message describing the cause of the exception
     * @param position zero-based character offset in the input, or {@link #UNKNOWN_POSITION}
     */
    public FormulaSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public FormulaSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.position = UNKNOWN_POSITION;
    }

    /**
     * Returns the zero-based character offset at which the error was detected.
     *
     * @return the offset, or {@link #UNKNOWN_POSITION} if the error is not positional
     */
    public int getPosition() {
        return position;
    }

    static String at(String message, int position) {
        return position == UNKNOWN_POSITION ? message : message + " at position " + position;
    }
}
