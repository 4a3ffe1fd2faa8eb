package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.api.Formula;
import io.github.cyfko.proplogic.core.api.Interpretation;

/**
 * Exception thrown when a formula is interpreted and a variable that is actually needed
 * has no value in the supplied {@link Interpretation}.
 * <p>
 * Variables skipped by short-circuit evaluation never trigger this exception: interpreting
 * {@code p & q} with {@code p = false} succeeds even if {@code q} is unassigned.
 * The failure is local to a single {@link Formula#interpret(Interpretation)} call; the formula
 * itself is untouched and can be interpreted again with a different assignment.
 * </p>
 *
 * <pre>{@code
 * try {
 *     boolean value = formula.interpret(Map.of("p", true));
 * } catch (MissingVariableException e) {
 *     // e.getVariableName() -> "q"
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class MissingVariableException extends RuntimeException {

    private final String variableName;

    /**
     * Creates an exception for the given unassigned variable.
     *
     * @param variableName name of the variable that has no value
     */
    public MissingVariableException(String variableName) {
        super("no value assigned to variable '" + variableName + "'");
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
