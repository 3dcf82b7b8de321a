package org.stablemir.api.ty;

public sealed interface BoundVariableKind
        permits BoundVariableKind.TyVar, BoundVariableKind.RegionVar, BoundVariableKind.ConstVar {

    record TyVar(BoundTyKind kind) implements BoundVariableKind {
    }

    record RegionVar(BoundRegionKind kind) implements BoundVariableKind {
    }

    record ConstVar() implements BoundVariableKind {
    }
}
