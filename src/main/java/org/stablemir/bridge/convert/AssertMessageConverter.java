package org.stablemir.bridge.convert;

import org.stablemir.api.mir.AssertMessage;
import org.stablemir.bridge.Tables;
import org.stablemir.internal.mir.AssertKind;

import static org.stablemir.bridge.convert.StableConverters.OPERANDS;

public final class AssertMessageConverter implements IStableConverter<AssertKind, AssertMessage> {

	@Override
	public AssertMessage stable(AssertKind kind, Tables tables) {
		return kind.accept(new AssertKind.Visitor<>() {
			@Override
			public AssertMessage visitBoundsCheck(AssertKind.BoundsCheck boundsCheck) {
				return new AssertMessage.BoundsCheck(
						OPERANDS.stable(boundsCheck.len(), tables),
						OPERANDS.stable(boundsCheck.index(), tables));
			}

			@Override
			public AssertMessage visitOverflow(AssertKind.Overflow overflow) {
				return new AssertMessage.Overflow(
						KindMappings.binOp(overflow.op()),
						OPERANDS.stable(overflow.lhs(), tables),
						OPERANDS.stable(overflow.rhs(), tables));
			}

			@Override
			public AssertMessage visitOverflowNeg(AssertKind.OverflowNeg overflowNeg) {
				return new AssertMessage.OverflowNeg(OPERANDS.stable(overflowNeg.operand(), tables));
			}

			@Override
			public AssertMessage visitDivisionByZero(AssertKind.DivisionByZero divisionByZero) {
				return new AssertMessage.DivisionByZero(OPERANDS.stable(divisionByZero.operand(), tables));
			}

			@Override
			public AssertMessage visitRemainderByZero(AssertKind.RemainderByZero remainderByZero) {
				return new AssertMessage.RemainderByZero(OPERANDS.stable(remainderByZero.operand(), tables));
			}

			@Override
			public AssertMessage visitResumedAfterReturn(AssertKind.ResumedAfterReturn resumedAfterReturn) {
				return new AssertMessage.ResumedAfterReturn(KindMappings.generatorKind(resumedAfterReturn.generatorKind()));
			}

			@Override
			public AssertMessage visitResumedAfterPanic(AssertKind.ResumedAfterPanic resumedAfterPanic) {
				return new AssertMessage.ResumedAfterPanic(KindMappings.generatorKind(resumedAfterPanic.generatorKind()));
			}

			@Override
			public AssertMessage visitMisalignedPointerDereference(AssertKind.MisalignedPointerDereference misaligned) {
				return new AssertMessage.MisalignedPointerDereference(
						OPERANDS.stable(misaligned.required(), tables),
						OPERANDS.stable(misaligned.found(), tables));
			}
		});
	}
}
