package org.stablemir.internal.mir;

import org.stablemir.internal.ty.Unsafety;

public sealed interface PointerCoercion permits PointerCoercion.Simple, PointerCoercion.ClosureFnPointer {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitSimple(Simple simple);
        R visitClosureFnPointer(ClosureFnPointer coercion);
    }

    enum Simple implements PointerCoercion {
        /** Function item to function pointer. */
        REIFY_FN_POINTER,
        /** Safe function pointer to unsafe function pointer. */
        UNSAFE_FN_POINTER,
        MUT_TO_CONST_POINTER,
        ARRAY_TO_POINTER,
        UNSIZE;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSimple(this);
        }
    }

    /**
     * Non-capturing closure to function pointer with the given safety.
     */
    record ClosureFnPointer(Unsafety unsafety) implements PointerCoercion {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClosureFnPointer(this);
        }
    }
}
