package org.stablemir.api.ty;

import java.util.List;

/**
 * Generic arguments in parameter order.
 */
public record GenericArgs(List<GenericArgKind> args) {

    public GenericArgs {
        args = List.copyOf(args);
    }
}
