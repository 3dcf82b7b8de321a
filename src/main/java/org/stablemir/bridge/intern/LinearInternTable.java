package org.stablemir.bridge.intern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Interns by scanning every value seen so far. Cheap for the handful of types a single query
 * touches; {@link HashConsingInternTable} scales to whole-crate sessions.
 */
public final class LinearInternTable<T> implements InternTable<T> {

    private final List<T> values = new ArrayList<>();

    @Override
    public int intern(T value) {
        Objects.requireNonNull(value, "value");
        int existing = values.indexOf(value);
        if (existing >= 0) {
            return existing;
        }
        values.add(value);
        return values.size() - 1;
    }

    @Override
    public T resolve(int handle) {
        if (handle < 0 || handle >= values.size()) {
            throw new IllegalArgumentException("Handle " + handle + " was not minted by this table (size " + values.size() + ")");
        }
        return values.get(handle);
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public List<T> values() {
        return List.copyOf(values);
    }
}
