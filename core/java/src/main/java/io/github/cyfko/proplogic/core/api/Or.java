package io.github.cyfko.proplogic.core.api;


import java.util.Objects;

/**
 * Disjunction {@code (left | right)}.
 * <p>
 * Evaluation short-circuits: when {@code left} is true, {@code right} is never evaluated.
 * </p>
 *
 * @param left  the first disjunct
 * @param right the second disjunct
 * @since 1.0.0
 */
public record Or(Formula left, Formula right) implements Formula {

    public Or {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public boolean interpret(Interpretation interpretation) {
        return left.interpret(interpretation) || right.interpret(interpretation);
    }

    @Override
    public String toString() {
        return "(" + left + " | " + right + ")";
    }
}
