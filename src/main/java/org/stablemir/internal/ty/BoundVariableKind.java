package org.stablemir.internal.ty;

/**
 * Kind of a variable bound by a {@link PolyFnSig} binder.
 */
public sealed interface BoundVariableKind
        permits BoundVariableKind.TyVar, BoundVariableKind.RegionVar, BoundVariableKind.ConstVar {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitTy(TyVar var);
        R visitRegion(RegionVar var);
        R visitConst(ConstVar var);
    }

    record TyVar(BoundTyKind kind) implements BoundVariableKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTy(this);
        }
    }

    record RegionVar(BoundRegionKind kind) implements BoundVariableKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRegion(this);
        }
    }

    record ConstVar() implements BoundVariableKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConst(this);
        }
    }
}
