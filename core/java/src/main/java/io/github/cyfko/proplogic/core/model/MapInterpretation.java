package io.github.cyfko.proplogic.core.model;

import io.github.cyfko.proplogic.core.api.Interpretation;

import java.util.Map;
import java.util.Optional;

/**
 * {@link Interpretation} backed by an immutable snapshot of a map.
 *
 * @param values variable name to truth value; copied on construction
 * @since 1.0.0
 */
public record MapInterpretation(Map<String, Boolean> values) implements Interpretation {

    public static final MapInterpretation EMPTY = new MapInterpretation(Map.of());

    /**
     * @throws NullPointerException if the map, a key or a value is {@code null}
     */
    public MapInterpretation {
        values = Map.copyOf(values);
    }

    @Override
    public Optional<Boolean> lookup(String variable) {
        return Optional.ofNullable(values.get(variable));
    }
}
