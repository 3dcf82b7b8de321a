package org.stablemir.internal.mir;

import org.stablemir.internal.DefId;
import org.stablemir.internal.ty.Const;
import java.util.Optional;

public sealed interface InlineAsmOperand
        permits InlineAsmOperand.In, InlineAsmOperand.Out, InlineAsmOperand.InOut,
        InlineAsmOperand.ConstOperand, InlineAsmOperand.SymFn, InlineAsmOperand.SymStatic {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitIn(In in);
        R visitOut(Out out);
        R visitInOut(InOut inOut);
        R visitConstOperand(ConstOperand constOperand);
        R visitSymFn(SymFn symFn);
        R visitSymStatic(SymStatic symStatic);
    }

    record In(String reg, Operand value) implements InlineAsmOperand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIn(this);
        }
    }

    record Out(String reg, boolean late, Optional<Place> place) implements InlineAsmOperand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOut(this);
        }
    }

    record InOut(String reg, boolean late, Operand inValue, Optional<Place> outPlace) implements InlineAsmOperand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInOut(this);
        }
    }

    record ConstOperand(Const value) implements InlineAsmOperand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstOperand(this);
        }
    }

    record SymFn(Const value) implements InlineAsmOperand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSymFn(this);
        }
    }

    record SymStatic(DefId def) implements InlineAsmOperand {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSymStatic(this);
        }
    }
}
