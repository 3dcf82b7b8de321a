package org.stablemir.internal.ty;

import java.util.List;

/**
 * A signature under a binder of late-bound variables.
 */
public record PolyFnSig(FnSig sig, List<BoundVariableKind> boundVars) {

    public PolyFnSig {
        boundVars = List.copyOf(boundVars);
    }

    public static PolyFnSig dummy(FnSig sig) {
        return new PolyFnSig(sig, List.of());
    }

    /**
     * @return The bound signature, ignoring the binder.
     */
    public FnSig skipBinder() {
        return sig;
    }
}
