package io.smartcalc.core.spi;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Mutable mapping from variable name to integer value. The evaluator only reads it; the assignment
 * handler is the only core component that writes it.
 *
 * <p>Every key satisfies {@link io.smartcalc.core.parse.Lexemes#isIdentifier(String)}. Entries are
 * created or overwritten, never removed. Names are case-sensitive.
 */
public interface VariableStore {

    /**
     * Looks up a variable.
     *
     * @param name the variable name
     * @return the bound value, or empty if the name is unbound
     */
    OptionalInt get(String name);

    /**
     * Binds {@code name} to {@code value}, replacing any previous binding.
     *
     * @throws IllegalArgumentException if {@code name} is not a valid identifier
     */
    void put(String name, int value);

    /** Returns {@code true} if {@code name} is bound. */
    boolean contains(String name);

    /** Returns an unmodifiable copy of all bindings, in insertion order. */
    Map<String, Integer> snapshot();
}
