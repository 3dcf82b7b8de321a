package org.stablemir.api.mir;

public sealed interface PointerCoercion
        permits PointerCoercion.ReifyFnPointer, PointerCoercion.UnsafeFnPointer, PointerCoercion.ClosureFnPointer,
        PointerCoercion.MutToConstPointer, PointerCoercion.ArrayToPointer, PointerCoercion.Unsize {

    record ReifyFnPointer() implements PointerCoercion {
    }

    record UnsafeFnPointer() implements PointerCoercion {
    }

    record ClosureFnPointer(Safety safety) implements PointerCoercion {
    }

    record MutToConstPointer() implements PointerCoercion {
    }

    record ArrayToPointer() implements PointerCoercion {
    }

    record Unsize() implements PointerCoercion {
    }
}
