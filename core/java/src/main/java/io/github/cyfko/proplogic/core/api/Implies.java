package io.github.cyfko.proplogic.core.api;


import java.util.Objects;

/**
 * Material implication {@code (antecedent -> consequent)}, i.e. {@code ~antecedent | consequent}.
 * <p>
 * A false antecedent makes the implication true without evaluating the consequent.
 * </p>
 *
 * @param antecedent the condition
 * @param consequent the conclusion
 * @since 1.0.0
 */
public record Implies(Formula antecedent, Formula consequent) implements Formula {

    public Implies {
        Objects.requireNonNull(antecedent, "Antecedent cannot be null");
        Objects.requireNonNull(consequent, "Consequent cannot be null");
    }

    @Override
    public boolean interpret(Interpretation interpretation) {
        return !antecedent.interpret(interpretation) || consequent.interpret(interpretation);
    }

    @Override
    public String toString() {
        return "(" + antecedent + " -> " + consequent + ")";
    }
}
