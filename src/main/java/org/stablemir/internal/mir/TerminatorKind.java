package org.stablemir.internal.mir;

import org.stablemir.internal.ty.Span;
import java.util.List;
import java.util.Optional;

/**
 * How control leaves a basic block.
 */
public sealed interface TerminatorKind
        permits TerminatorKind.Goto, TerminatorKind.SwitchInt, TerminatorKind.UnwindResume,
        TerminatorKind.UnwindTerminate, TerminatorKind.Return, TerminatorKind.Unreachable,
        TerminatorKind.Drop, TerminatorKind.Call, TerminatorKind.Assert, TerminatorKind.Yield,
        TerminatorKind.GeneratorDrop, TerminatorKind.FalseEdge, TerminatorKind.FalseUnwind,
        TerminatorKind.InlineAsm {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitGoto(Goto gotoKind);
        R visitSwitchInt(SwitchInt switchInt);
        R visitUnwindResume(UnwindResume resume);
        R visitUnwindTerminate(UnwindTerminate terminate);
        R visitReturn(Return returnKind);
        R visitUnreachable(Unreachable unreachable);
        R visitDrop(Drop drop);
        R visitCall(Call call);
        R visitAssert(Assert assertKind);
        R visitYield(Yield yieldKind);
        R visitGeneratorDrop(GeneratorDrop generatorDrop);
        R visitFalseEdge(FalseEdge falseEdge);
        R visitFalseUnwind(FalseUnwind falseUnwind);
        R visitInlineAsm(InlineAsm inlineAsm);
    }

    record Goto(int target) implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGoto(this);
        }
    }

    record SwitchInt(Operand discr, SwitchTargets targets) implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSwitchInt(this);
        }
    }

    /**
     * Continues unwinding after a cleanup block.
     */
    record UnwindResume() implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnwindResume(this);
        }
    }

    /**
     * Aborts because unwinding reached a point it must not pass.
     */
    record UnwindTerminate() implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnwindTerminate(this);
        }
    }

    record Return() implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record Unreachable() implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnreachable(this);
        }
    }

    record Drop(Place place, int target, UnwindAction unwind, boolean replace) implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDrop(this);
        }
    }

    /**
     * A function call. {@code target} is empty when the callee diverges.
     */
    record Call(Operand func, List<Operand> args, Place destination, Optional<Integer> target, UnwindAction unwind, String callSource, Span fnSpan) implements TerminatorKind {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Assert(Operand cond, boolean expected, AssertKind msg, int target, UnwindAction unwind) implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssert(this);
        }
    }

    /**
     * Generator suspension point; removed by generator lowering.
     */
    record Yield(Operand value, int resume, Place resumeArg, Optional<Integer> drop) implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitYield(this);
        }
    }

    /**
     * Drop of a suspended generator; removed by generator lowering.
     */
    record GeneratorDrop() implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGeneratorDrop(this);
        }
    }

    /**
     * Borrow-check only edge, removed before optimization.
     */
    record FalseEdge(int realTarget, int imaginaryTarget) implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFalseEdge(this);
        }
    }

    /**
     * Borrow-check only edge, removed before optimization.
     */
    record FalseUnwind(int realTarget, UnwindAction unwind) implements TerminatorKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFalseUnwind(this);
        }
    }

    record InlineAsm(List<String> template, List<InlineAsmOperand> operands, List<String> options, List<Span> lineSpans, Optional<Integer> destination, UnwindAction unwind) implements TerminatorKind {
        public InlineAsm {
            template = List.copyOf(template);
            operands = List.copyOf(operands);
            options = List.copyOf(options);
            lineSpans = List.copyOf(lineSpans);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInlineAsm(this);
        }
    }
}
