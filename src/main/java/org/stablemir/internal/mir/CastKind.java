package org.stablemir.internal.mir;

/**
 * Kind of an {@code as} cast or implicit coercion. Payload-free kinds are the constants of
 * {@link Simple}; pointer coercions carry their own kind.
 */
public sealed interface CastKind permits CastKind.Simple, CastKind.PointerCoercionCast {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitSimple(Simple simple);
        R visitPointerCoercion(PointerCoercionCast cast);
    }

    enum Simple implements CastKind {
        POINTER_EXPOSE_ADDRESS,
        POINTER_FROM_EXPOSED_ADDRESS,
        DYN_STAR,
        INT_TO_INT,
        FLOAT_TO_INT,
        FLOAT_TO_FLOAT,
        INT_TO_FLOAT,
        PTR_TO_PTR,
        FN_PTR_TO_PTR,
        TRANSMUTE;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSimple(this);
        }
    }

    record PointerCoercionCast(PointerCoercion coercion) implements CastKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPointerCoercion(this);
        }
    }
}
