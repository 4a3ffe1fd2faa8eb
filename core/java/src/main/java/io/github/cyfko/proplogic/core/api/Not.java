package io.github.cyfko.proplogic.core.api;


import java.util.Objects;

/**
 * Negation {@code ~operand}.
 * <p>
 * Renders as {@code "~"} followed by the operand, without parentheses of its own: a binary
 * operand already parenthesizes itself, so {@code Not(And(p, q))} renders {@code ~(p & q)}.
 * </p>
 *
 * @param operand the negated formula
 * @since 1.0.0
 */
public record Not(Formula operand) implements Formula {

    public Not {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public boolean interpret(Interpretation interpretation) {
        return !operand.interpret(interpretation);
    }

    @Override
    public String toString() {
        return "~" + operand;
    }
}
