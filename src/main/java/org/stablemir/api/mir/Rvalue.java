package org.stablemir.api.mir;

import org.stablemir.api.CrateItem;
import org.stablemir.api.ty.Opaque;
import org.stablemir.api.ty.Ty;

public sealed interface Rvalue
        permits Rvalue.Use, Rvalue.Ref, Rvalue.ThreadLocalRef, Rvalue.AddressOf, Rvalue.Len, Rvalue.Cast,
        Rvalue.BinaryOp, Rvalue.CheckedBinaryOp, Rvalue.NullaryOp, Rvalue.UnaryOp, Rvalue.Discriminant,
        Rvalue.CopyForDeref {

    record Use(Operand operand) implements Rvalue {
    }

    record Ref(Opaque region, BorrowKind kind, Place place) implements Rvalue {
    }

    record ThreadLocalRef(CrateItem item) implements Rvalue {
    }

    record AddressOf(Mutability mutability, Place place) implements Rvalue {
    }

    record Len(Place place) implements Rvalue {
    }

    record Cast(CastKind kind, Operand operand, Ty target) implements Rvalue {
    }

    record BinaryOp(BinOp op, Operand lhs, Operand rhs) implements Rvalue {
    }

    record CheckedBinaryOp(BinOp op, Operand lhs, Operand rhs) implements Rvalue {
    }

    record NullaryOp(NullOp op, Ty ty) implements Rvalue {
    }

    record UnaryOp(UnOp op, Operand operand) implements Rvalue {
    }

    record Discriminant(Place place) implements Rvalue {
    }

    record CopyForDeref(Place place) implements Rvalue {
    }
}
