package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.MissingVariableException;

import java.util.Objects;

/**
 * Leaf formula naming one boolean variable.
 * <p>
 * The name is opaque: any string is accepted, including the empty string or text with spaces
 * and symbols. Only names matching {@code [A-Za-z_][A-Za-z0-9_]*} can be read back by the parser;
 * the others exist only through direct construction.
 * </p>
 *
 * @param name the variable name, rendered verbatim
 * @since 1.0.0
 */
public record Atomic(String name) implements Formula {

    public Atomic {
        Objects.requireNonNull(name, "Variable name cannot be null");
    }

    @Override
    public boolean interpret(Interpretation interpretation) {
        return interpretation.lookup(name).orElseThrow(() -> new MissingVariableException(name));
    }

    @Override
    public String toString() {
        return name;
    }
}
