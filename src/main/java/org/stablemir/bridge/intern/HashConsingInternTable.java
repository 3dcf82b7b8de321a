package org.stablemir.bridge.intern;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interns through a hash index over the values seen so far; hands out exactly the same handles as
 * {@link LinearInternTable} for the same sequence of values.
 */
public final class HashConsingInternTable<T> implements InternTable<T> {

    private final List<T> values = new ArrayList<>();
    private final Map<T, Integer> index = new HashMap<>();

    @Override
    public int intern(T value) {
        Objects.requireNonNull(value, "value");
        Integer existing = index.get(value);
        if (existing != null) {
            return existing;
        }
        int handle = values.size();
        values.add(value);
        index.put(value, handle);
        return handle;
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
