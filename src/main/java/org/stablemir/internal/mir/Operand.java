package org.stablemir.internal.mir;

import org.stablemir.internal.ty.Const;

/**
 * A value read by an rvalue or terminator.
 */
public sealed interface Operand
        permits Operand.Copy, Operand.Move, Operand.Constant {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitCopy(Copy copy);
        R visitMove(Move move);
        R visitConstant(Constant constant);
    }

    record Copy(Place place) implements Operand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCopy(this);
        }
    }

    record Move(Place place) implements Operand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMove(this);
        }
    }

    record Constant(Const constant) implements Operand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }
}
