package org.stablemir.internal.mir;

import org.stablemir.internal.DefId;
import org.stablemir.internal.ty.Const;
import org.stablemir.internal.ty.Mutability;
import org.stablemir.internal.ty.Region;
import org.stablemir.internal.ty.Ty;
import java.util.List;

/**
 * The right-hand side of an assignment.
 */
public sealed interface Rvalue
        permits Rvalue.Use, Rvalue.Repeat, Rvalue.Ref, Rvalue.ThreadLocalRef, Rvalue.AddressOf, Rvalue.Len,
        Rvalue.Cast, Rvalue.BinaryOp, Rvalue.CheckedBinaryOp, Rvalue.NullaryOp, Rvalue.UnaryOp,
        Rvalue.Discriminant, Rvalue.Aggregate, Rvalue.ShallowInitBox, Rvalue.CopyForDeref {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitUse(Use use);
        R visitRepeat(Repeat repeat);
        R visitRef(Ref ref);
        R visitThreadLocalRef(ThreadLocalRef threadLocalRef);
        R visitAddressOf(AddressOf addressOf);
        R visitLen(Len len);
        R visitCast(Cast cast);
        R visitBinaryOp(BinaryOp binaryOp);
        R visitCheckedBinaryOp(CheckedBinaryOp checkedBinaryOp);
        R visitNullaryOp(NullaryOp nullaryOp);
        R visitUnaryOp(UnaryOp unaryOp);
        R visitDiscriminant(Discriminant discriminant);
        R visitAggregate(Aggregate aggregate);
        R visitShallowInitBox(ShallowInitBox shallowInitBox);
        R visitCopyForDeref(CopyForDeref copyForDeref);
    }

    record Use(Operand operand) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUse(this);
        }
    }

    /**
     * Creates an array with {@code count} copies of the operand.
     */
    record Repeat(Operand operand, Const count) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepeat(this);
        }
    }

    record Ref(Region region, BorrowKind kind, Place place) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRef(this);
        }
    }

    /**
     * Address of a thread local static.
     */
    record ThreadLocalRef(DefId def) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThreadLocalRef(this);
        }
    }

    /**
     * Creates a raw pointer without an intermediate reference.
     */
    record AddressOf(Mutability mutability, Place place) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAddressOf(this);
        }
    }

    /**
     * Length of an array or slice.
     */
    record Len(Place place) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLen(this);
        }
    }

    record Cast(CastKind kind, Operand operand, Ty target) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCast(this);
        }
    }

    record BinaryOp(BinOp op, Operand lhs, Operand rhs) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    /**
     * Produces a {@code (result, overflowed)} pair.
     */
    record CheckedBinaryOp(BinOp op, Operand lhs, Operand rhs) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCheckedBinaryOp(this);
        }
    }

    record NullaryOp(NullOp op, Ty ty) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNullaryOp(this);
        }
    }

    record UnaryOp(UnOp op, Operand operand) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /**
     * Reads the discriminant of an enum.
     */
    record Discriminant(Place place) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDiscriminant(this);
        }
    }

    /**
     * Builds a tuple, array, ADT, closure or generator from its parts.
     */
    record Aggregate(String kind, List<Operand> operands) implements Rvalue {
        public Aggregate {
            operands = List.copyOf(operands);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAggregate(this);
        }
    }

    record ShallowInitBox(Operand pointer, Ty ty) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitShallowInitBox(this);
        }
    }

    /**
     * A copy of a place that is immediately dereferenced.
     */
    record CopyForDeref(Place place) implements Rvalue {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCopyForDeref(this);
        }
    }
}
