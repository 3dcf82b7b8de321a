package org.stablemir.internal.mir;

import org.stablemir.internal.ty.Mutability;
import org.stablemir.internal.ty.Ty;

public record LocalDecl(Ty ty, Mutability mutability) {

    public static LocalDecl of(Ty ty) {
        return new LocalDecl(ty, Mutability.MUT);
    }
}
