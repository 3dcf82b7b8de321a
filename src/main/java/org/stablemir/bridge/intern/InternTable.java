package org.stablemir.bridge.intern;

import java.util.List;

/**
 * Append-only table handing out small integer handles for values, deduplicated by
 * {@link Object#equals(Object)}.
 * <p>
 * Contract for every implementation: equal values get the same handle, distinct values get
 * distinct handles, the n-th distinct value gets handle {@code n - 1}, and a handle never changes
 * meaning while the table lives.
 *
 * @param <T> The interned value type. Must implement value equality and a consistent hash code.
 */
public interface InternTable<T> {

    /**
     * @param value The value to intern.
     * @return The existing handle of an equal value, or a freshly minted one.
     */
    int intern(T value);

    /**
     * @param handle A handle returned by {@link #intern(Object)} on this table.
     * @return The value first interned under that handle.
     * @throws IllegalArgumentException if this table never minted the handle.
     */
    T resolve(int handle);

    /**
     * @return The number of distinct values interned so far.
     */
    int size();

    /**
     * @return A copy of the interned values, indexed by handle.
     */
    List<T> values();
}
