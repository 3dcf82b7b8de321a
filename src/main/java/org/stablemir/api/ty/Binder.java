package org.stablemir.api.ty;

import java.util.List;

/**
 * A value under a binder introducing {@code boundVars}.
 */
public record Binder<T>(T value, List<BoundVariableKind> boundVars) {

    public Binder {
        boundVars = List.copyOf(boundVars);
    }
}
