package org.stablemir.internal.ty;

import org.stablemir.internal.DefId;

import java.util.Optional;

public sealed interface BoundRegionKind
        permits BoundRegionKind.BrAnon, BoundRegionKind.BrNamed, BoundRegionKind.BrEnv {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitAnon(BrAnon anon);
        R visitNamed(BrNamed named);
        R visitEnv(BrEnv env);
    }

    /**
     * An anonymous region, optionally with the span it was created for.
     */
    record BrAnon(Optional<Span> span) implements BoundRegionKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnon(this);
        }
    }

    record BrNamed(DefId def, String name) implements BoundRegionKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNamed(this);
        }
    }

    /**
     * The region of a closure's environment.
     */
    record BrEnv() implements BoundRegionKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEnv(this);
        }
    }
}
