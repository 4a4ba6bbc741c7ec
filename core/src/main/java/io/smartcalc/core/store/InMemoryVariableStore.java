package io.smartcalc.core.store;

import io.smartcalc.core.parse.Lexemes;
import io.smartcalc.core.spi.VariableStore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * {@link VariableStore} backed by a {@link LinkedHashMap}. One instance per session.
 *
 * <p>Not thread-safe: a session processes its lines strictly one after another.
 */
public final class InMemoryVariableStore implements VariableStore {

    private final Map<String, Integer> values = new LinkedHashMap<>();

    @Override
    public OptionalInt get(String name) {
        Integer value = values.get(name);
        return value != null ? OptionalInt.of(value) : OptionalInt.empty();
    }

    @Override
    public void put(String name, int value) {
        if (!Lexemes.isIdentifier(name)) {
            throw new IllegalArgumentException("Variable name must contain only Latin letters, got: '" + name + "'");
        }
        values.put(name, value);
    }

    @Override
    public boolean contains(String name) {
        return values.containsKey(name);
    }

    @Override
    public Map<String, Integer> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Returns the number of bound variables. */
    public int size() {
        return values.size();
    }
}
