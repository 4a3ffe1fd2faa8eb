package io.github.cyfko.proplogic.core.api;


import java.util.Objects;

/**
 * Conjunction {@code (left & right)}.
 * <p>
 * Evaluation short-circuits: when {@code left} is false, {@code right} is never evaluated, so
 * its variables may be left unassigned.
 * </p>
 *
 * @param left  the first conjunct
 * @param right the second conjunct
 * @since 1.0.0
 */
public record And(Formula left, Formula right) implements Formula {

    public And {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public boolean interpret(Interpretation interpretation) {
        return left.interpret(interpretation) && right.interpret(interpretation);
    }

    @Override
    public String toString() {
        return "(" + left + " & " + right + ")";
    }
}
