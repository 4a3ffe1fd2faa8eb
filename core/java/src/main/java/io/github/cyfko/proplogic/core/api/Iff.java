package io.github.cyfko.proplogic.core.api;


import java.util.Objects;

/**
 * Biconditional {@code (left <-> right)}.
 * <p>
 * Both sides are always evaluated, so every variable either side needs must be assigned.
 * </p>
 *
 * @param left  the first operand
 * @param right the second operand
 * @since 1.0.0
 */
public record Iff(Formula left, Formula right) implements Formula {

    public Iff {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public boolean interpret(Interpretation interpretation) {
        return left.interpret(interpretation) == right.interpret(interpretation);
    }

    @Override
    public String toString() {
        return "(" + left + " <-> " + right + ")";
    }
}
