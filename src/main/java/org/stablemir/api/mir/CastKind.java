package org.stablemir.api.mir;

public sealed interface CastKind
        permits CastKind.PointerExposeAddress, CastKind.PointerFromExposedAddress, CastKind.PointerCoercionCast,
        CastKind.DynStar, CastKind.IntToInt, CastKind.FloatToInt, CastKind.FloatToFloat, CastKind.IntToFloat,
        CastKind.PtrToPtr, CastKind.FnPtrToPtr, CastKind.Transmute {

    record PointerExposeAddress() implements CastKind {
    }

    record PointerFromExposedAddress() implements CastKind {
    }

    record PointerCoercionCast(PointerCoercion coercion) implements CastKind {
    }

    record DynStar() implements CastKind {
    }

    record IntToInt() implements CastKind {
    }

    record FloatToInt() implements CastKind {
    }

    record FloatToFloat() implements CastKind {
    }

    record IntToFloat() implements CastKind {
    }

    record PtrToPtr() implements CastKind {
    }

    record FnPtrToPtr() implements CastKind {
    }

    record Transmute() implements CastKind {
    }
}
