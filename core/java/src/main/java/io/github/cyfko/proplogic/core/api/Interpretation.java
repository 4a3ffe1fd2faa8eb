package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.model.MapInterpretation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Assignment of truth values to variable names, supplied for a single evaluation call.
 * <p>
 * An interpretation may be partial: variables it does not mention simply have no value, and
 * a formula only fails if it actually needs one of them. Interpretations are never stored on a
 * formula.
 * </p>
 *
 * <h2>Creating interpretations</h2>
 * <pre>{@code
 * // Inline, in the style of Map.of
 * Interpretation i1 = Interpretation.of("p", true, "q", false);
 *
 * // From an existing map
 * Interpretation i2 = Interpretation.from(Map.of("p", true, "q", false));
 *
 * // Incrementally
 * Interpretation i3 = Interpretation.builder().assign("p", true).assign("q", false).build();
 * }</pre>
 *
 * <p>All three forms are equivalent and produce the same evaluation results.</p>
 *
 * @see Formula#interpret(Interpretation)
 * @author PropLogic Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Interpretation {

    /**
     * Looks up the truth value assigned to a variable.
     *
     * @param variable the variable name
     * @return the assigned value, or an empty optional if the variable is unassigned
     */
    Optional<Boolean> lookup(String variable);

    /**
     * @return an interpretation that assigns no variable
     */
    static Interpretation of() {
        return MapInterpretation.EMPTY;
    }

    /**
     * Creates an interpretation assigning a single variable.
     *
     * @param v1 variable name
     * @param b1 its truth value
     * @return the interpretation
     * @throws NullPointerException if {@code v1} is {@code null}
     */
    static Interpretation of(String v1, boolean b1) {
        return new MapInterpretation(Map.of(v1, b1));
    }

    /**
     * Creates an interpretation assigning two variables.
     * <p>
     * As with {@link Map#of}, a name may appear only once:
     * {@code of("p", true, "p", false)} is rejected.
     * </p>
     *
     * @return the interpretation
     * @throws IllegalArgumentException if a variable name is repeated
     * @throws NullPointerException     if a variable name is {@code null}
     */
    static Interpretation of(String v1, boolean b1, String v2, boolean b2) {
        return new MapInterpretation(Map.of(v1, b1, v2, b2));
    }

    /**
     * Creates an interpretation assigning three variables. Use {@link #builder()} or
     * {@link #from(Map)} for more.
     *
     * @return the interpretation
     * @throws IllegalArgumentException if a variable name is repeated
     * @throws NullPointerException     if a variable name is {@code null}
     */
    static Interpretation of(String v1, boolean b1, String v2, boolean b2, String v3, boolean b3) {
        return new MapInterpretation(Map.of(v1, b1, v2, b2, v3, b3));
    }

    /**
     * Creates an interpretation holding a snapshot of the given map.
     *
     * @param values variable name to truth value
     * @return the interpretation
     * @throws NullPointerException if the map, a key or a value is {@code null}
     */
    static Interpretation from(Map<String, Boolean> values) {
        Objects.requireNonNull(values, "values cannot be null");
        return new MapInterpretation(values);
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Incremental construction of an {@link Interpretation}.
     * <p>
     * Unlike {@code of(...)}, assigning a name twice is allowed and the last value wins.
     * {@link #build()} takes a snapshot, so the builder can keep being used afterwards.
     * </p>
     */
    class Builder {
        private final Map<String, Boolean> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder assign(String variable, boolean value) {
            values.put(Objects.requireNonNull(variable, "variable cannot be null"), value);
            return this;
        }

        public Interpretation build() {
            return new MapInterpretation(values);
        }
    }
}
