package org.stablemir.internal.ty;

import org.stablemir.internal.DefId;

public sealed interface BoundTyKind permits BoundTyKind.Anon, BoundTyKind.Param {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitAnon(Anon anon);
        R visitParam(Param param);
    }

    record Anon() implements BoundTyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnon(this);
        }
    }

    record Param(DefId def, String name) implements BoundTyKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParam(this);
        }
    }
}
