package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.MissingVariableException;

import java.util.Map;

/**
 * Immutable propositional-logic formula over named boolean variables.
 * <p>
 * A formula is a finite tree made of exactly six node kinds, each implemented as a record. The
 * interface is sealed, so no other implementation can exist:
 * </p>
 * <table border="1">
 * <caption>Node kinds</caption>
 * <thead>
 * <tr><th>Node</th><th>Arity</th><th>Rendering</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@link Atomic}</td><td>0</td><td>{@code name}</td></tr>
 * <tr><td>{@link Not}</td><td>1</td><td>{@code ~x}</td></tr>
 * <tr><td>{@link And}</td><td>2</td><td>{@code (l & r)}</td></tr>
 * <tr><td>{@link Or}</td><td>2</td><td>{@code (l | r)}</td></tr>
 * <tr><td>{@link Implies}</td><td>2</td><td>{@code (l -> r)}</td></tr>
 * <tr><td>{@link Iff}</td><td>2</td><td>{@code (l <-> r)}</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Core Concepts</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> composition methods always allocate new nodes and never
 *       modify their operands, so formulas can be shared freely between threads.</li>
 *   <li><strong>Structural equality:</strong> two formulas are equal iff they have the same node
 *       kind at every position with equal payloads. {@code p & q} is not equal to {@code q & p}.</li>
 *   <li><strong>Canonical rendering:</strong> {@link #toString()} fully parenthesizes every
 *       binary node and never parenthesizes an atomic or a negation. The rendered text parses
 *       back to an equal tree whenever every atomic name is a valid identifier.</li>
 *   <li><strong>Explicit evaluation:</strong> a formula is never a boolean by itself; its truth
 *       value only exists relative to an {@link Interpretation}.</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Formula p = new Atomic("p");
 * Formula q = new Atomic("q");
 *
 * Formula modusPonens = p.implies(q).and(p).implies(q);
 * modusPonens.toString();                          // "(((p -> q) & p) -> q)"
 * modusPonens.interpret(Map.of("p", true, "q", false)); // true
 * modusPonens.interpret(Interpretation.of("p", false, "q", false)); // true
 * }</pre>
 *
 * @see Interpretation
 * @see FormulaParser
 * @author PropLogic Team
 * @since 1.0.0
 */
public sealed interface Formula permits Atomic, Not, And, Or, Implies, Iff {

    /**
     * Evaluates this formula under the given assignment.
     * <p>
     * {@code &}, {@code |} and {@code ->} short-circuit exactly like Java's {@code &&}, {@code ||}
     * and {@code !l || r}: once the left operand decides the result, the right operand is not
     * evaluated and its variables need not be assigned. {@code <->} always evaluates both sides.
     * </p>
     *
     * @param interpretation the variable assignment to evaluate against
     * @return the truth value of this formula
     * @throws MissingVariableException if a variable needed for the result is not assigned
     */
    boolean interpret(Interpretation interpretation);

    /**
     * Evaluates this formula under an assignment given as a map.
     * <p>
     * Equivalent to {@code interpret(Interpretation.from(values))}.
     * </p>
     *
     * @param values variable name to truth value; must not contain {@code null} keys or values
     * @return the truth value of this formula
     * @throws MissingVariableException if a variable needed for the result is not assigned
     */
    default boolean interpret(Map<String, Boolean> values) {
        return interpret(Interpretation.from(values));
    }

    /**
     * @param other right operand
     * @return a new formula representing {@code (this & other)}
     */
    default Formula and(Formula other) {
        return new And(this, other);
    }

    /**
     * @param other right operand
     * @return a new formula representing {@code (this | other)}
     */
    default Formula or(Formula other) {
        return new Or(this, other);
    }

    /**
     * @param other the consequent
     * @return a new formula representing {@code (this -> other)}
     */
    default Formula implies(Formula other) {
        return new Implies(this, other);
    }

    /**
     * @param other right operand
     * @return a new formula representing {@code (this <-> other)}
     */
    default Formula iff(Formula other) {
        return new Iff(this, other);
    }

    /**
     * @return a new formula representing {@code ~this}
     */
    default Formula not() {
        return new Not(this);
    }

    /**
     * Returns the canonical rendering of this formula.
     *
     * @return the fully parenthesized textual form
     */
    @Override
    String toString();
}
