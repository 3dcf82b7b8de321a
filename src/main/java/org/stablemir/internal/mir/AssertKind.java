package org.stablemir.internal.mir;

/**
 * Reason a runtime check can fail.
 */
public sealed interface AssertKind
        permits AssertKind.BoundsCheck, AssertKind.Overflow, AssertKind.OverflowNeg,
        AssertKind.DivisionByZero, AssertKind.RemainderByZero, AssertKind.ResumedAfterReturn,
        AssertKind.ResumedAfterPanic, AssertKind.MisalignedPointerDereference {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitBoundsCheck(BoundsCheck boundsCheck);
        R visitOverflow(Overflow overflow);
        R visitOverflowNeg(OverflowNeg overflowNeg);
        R visitDivisionByZero(DivisionByZero divisionByZero);
        R visitRemainderByZero(RemainderByZero remainderByZero);
        R visitResumedAfterReturn(ResumedAfterReturn resumedAfterReturn);
        R visitResumedAfterPanic(ResumedAfterPanic resumedAfterPanic);
        R visitMisalignedPointerDereference(MisalignedPointerDereference misaligned);
    }

    record BoundsCheck(Operand len, Operand index) implements AssertKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoundsCheck(this);
        }
    }

    record Overflow(BinOp op, Operand lhs, Operand rhs) implements AssertKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOverflow(this);
        }
    }

    record OverflowNeg(Operand operand) implements AssertKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOverflowNeg(this);
        }
    }

    record DivisionByZero(Operand operand) implements AssertKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDivisionByZero(this);
        }
    }

    record RemainderByZero(Operand operand) implements AssertKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRemainderByZero(this);
        }
    }

    record ResumedAfterReturn(GeneratorKind generatorKind) implements AssertKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitResumedAfterReturn(this);
        }
    }

    record ResumedAfterPanic(GeneratorKind generatorKind) implements AssertKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitResumedAfterPanic(this);
        }
    }

    record MisalignedPointerDereference(Operand required, Operand found) implements AssertKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMisalignedPointerDereference(this);
        }
    }
}
