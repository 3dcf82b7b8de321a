package org.stablemir.internal.mir;

import java.util.Arrays;
import java.util.List;

/**
 * A memory location: a local followed by a projection chain.
 */
public record Place(int local, List<ProjectionElem> projection) {

    public Place {
        if (local < 0) {
            throw new IllegalArgumentException("Local index must not be negative: " + local);
        }
        projection = List.copyOf(projection);
    }

    public static Place local(int local) {
        return new Place(local, List.of());
    }

    public static Place of(int local, ProjectionElem... projection) {
        return new Place(local, Arrays.asList(projection));
    }

    /**
     * @return The local index as the compiler prints it, e.g. {@code _3}.
     */
    @Override
    public String toString() {
        return "_" + local + (projection.isEmpty() ? "" : projection.toString());
    }
}
