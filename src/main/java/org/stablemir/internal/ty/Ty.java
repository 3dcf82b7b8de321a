package org.stablemir.internal.ty;

import java.util.Arrays;
import java.util.List;

/**
 * A compiler type. Two types are the same type exactly when they are {@link #equals(Object) equal};
 * the compiler hands out structurally shared values, this model compares by value.
 *
 * @param kind The structure of the type.
 */
public record Ty(TyKind kind) {

    public static final Ty BOOL = new Ty(new TyKind.Bool());
    public static final Ty CHAR = new Ty(new TyKind.Char());
    public static final Ty STR = new Ty(new TyKind.Str());
    public static final Ty NEVER = new Ty(new TyKind.Never());
    public static final Ty UNIT = new Ty(new TyKind.Tuple(List.of()));
    public static final Ty USIZE = uint(UintTy.USIZE);
    public static final Ty U8 = uint(UintTy.U8);
    public static final Ty I32 = intTy(IntTy.I32);

    public static Ty intTy(IntTy intTy) {
        return new Ty(new TyKind.Int(intTy));
    }

    public static Ty uint(UintTy uintTy) {
        return new Ty(new TyKind.Uint(uintTy));
    }

    public static Ty floatTy(FloatTy floatTy) {
        return new Ty(new TyKind.Float(floatTy));
    }

    public static Ty tuple(Ty... fields) {
        return new Ty(new TyKind.Tuple(Arrays.asList(fields)));
    }

    public static Ty slice(Ty element) {
        return new Ty(new TyKind.Slice(element));
    }

    public static Ty ref(Region region, Ty referent, Mutability mutability) {
        return new Ty(new TyKind.Ref(region, referent, mutability));
    }

    public static Ty rawPtr(Ty pointee, Mutability mutability) {
        return new Ty(new TyKind.RawPtr(pointee, mutability));
    }

    @Override
    public String toString() {
        return kind.toString();
    }
}
