package org.stablemir.bridge.convert;

import org.stablemir.api.mir.Operand;
import org.stablemir.bridge.Tables;

import static org.stablemir.bridge.convert.StableConverters.PLACES;

public final class OperandConverter implements IStableConverter<org.stablemir.internal.mir.Operand, Operand> {

	@Override
	public Operand stable(org.stablemir.internal.mir.Operand operand, Tables tables) {
		return operand.accept(new org.stablemir.internal.mir.Operand.Visitor<>() {
			@Override
			public Operand visitCopy(org.stablemir.internal.mir.Operand.Copy copy) {
				return new Operand.Copy(PLACES.stable(copy.place(), tables));
			}

			@Override
			public Operand visitMove(org.stablemir.internal.mir.Operand.Move move) {
				return new Operand.Move(PLACES.stable(move.place(), tables));
			}

			@Override
			public Operand visitConstant(org.stablemir.internal.mir.Operand.Constant constant) {
				return new Operand.Constant(constant.constant().toString());
			}
		});
	}
}
