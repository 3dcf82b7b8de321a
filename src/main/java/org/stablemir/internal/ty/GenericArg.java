package org.stablemir.internal.ty;

/**
 * One positional generic argument.
 */
public sealed interface GenericArg permits GenericArg.Lifetime, GenericArg.Type, GenericArg.ConstArg {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLifetime(Lifetime lifetime);
        R visitType(Type type);
        R visitConst(ConstArg constArg);
    }

    record Lifetime(Region region) implements GenericArg {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLifetime(this);
        }
    }

    record Type(Ty ty) implements GenericArg {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitType(this);
        }
    }

    record ConstArg(Const value) implements GenericArg {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConst(this);
        }
    }
}
