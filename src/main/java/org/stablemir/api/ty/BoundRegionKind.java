package org.stablemir.api.ty;

import java.util.Optional;

public sealed interface BoundRegionKind
        permits BoundRegionKind.BrAnon, BoundRegionKind.BrNamed, BoundRegionKind.BrEnv {

    /**
     * @param span Where the region was introduced, rendered; empty when unknown.
     */
    record BrAnon(Optional<Opaque> span) implements BoundRegionKind {
    }

    record BrNamed(BrNamedDef def, String name) implements BoundRegionKind {
    }

    record BrEnv() implements BoundRegionKind {
    }
}
