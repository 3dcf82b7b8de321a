package org.stablemir.api.ty;

public sealed interface BoundTyKind permits BoundTyKind.Anon, BoundTyKind.Param {

    record Anon() implements BoundTyKind {
    }

    record Param(ParamDef def, String name) implements BoundTyKind {
    }
}
