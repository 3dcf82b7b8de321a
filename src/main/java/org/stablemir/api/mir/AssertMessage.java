package org.stablemir.api.mir;

public sealed interface AssertMessage
        permits AssertMessage.BoundsCheck, AssertMessage.Overflow, AssertMessage.OverflowNeg,
        AssertMessage.DivisionByZero, AssertMessage.RemainderByZero, AssertMessage.ResumedAfterReturn,
        AssertMessage.ResumedAfterPanic, AssertMessage.MisalignedPointerDereference {

    record BoundsCheck(Operand len, Operand index) implements AssertMessage {
    }

    record Overflow(BinOp op, Operand lhs, Operand rhs) implements AssertMessage {
    }

    record OverflowNeg(Operand operand) implements AssertMessage {
    }

    record DivisionByZero(Operand operand) implements AssertMessage {
    }

    record RemainderByZero(Operand operand) implements AssertMessage {
    }

    record ResumedAfterReturn(GeneratorKind generatorKind) implements AssertMessage {
    }

    record ResumedAfterPanic(GeneratorKind generatorKind) implements AssertMessage {
    }

    record MisalignedPointerDereference(Operand required, Operand found) implements AssertMessage {
    }
}
