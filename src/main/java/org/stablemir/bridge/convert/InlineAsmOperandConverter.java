package org.stablemir.bridge.convert;

import org.stablemir.api.mir.InlineAsmOperand;
import org.stablemir.api.mir.Operand;
import org.stablemir.api.mir.Place;
import org.stablemir.bridge.Tables;

import java.util.Optional;

import static org.stablemir.bridge.convert.StableConverters.OPERANDS;
import static org.stablemir.bridge.convert.StableConverters.PLACES;

/**
 * Exposes the input value and output place of register operands. Everything else about an operand
 * survives only in its raw rendering.
 */
public final class InlineAsmOperandConverter
		implements IStableConverter<org.stablemir.internal.mir.InlineAsmOperand, InlineAsmOperand> {

	@Override
	public InlineAsmOperand stable(org.stablemir.internal.mir.InlineAsmOperand operand, Tables tables) {
		String rawRepr = operand.toString();
		return operand.accept(new org.stablemir.internal.mir.InlineAsmOperand.Visitor<>() {
			@Override
			public InlineAsmOperand visitIn(org.stablemir.internal.mir.InlineAsmOperand.In in) {
				return new InlineAsmOperand(Optional.of(OPERANDS.stable(in.value(), tables)), Optional.empty(), rawRepr);
			}

			@Override
			public InlineAsmOperand visitOut(org.stablemir.internal.mir.InlineAsmOperand.Out out) {
				return new InlineAsmOperand(Optional.empty(), out.place().map(place -> PLACES.stable(place, tables)), rawRepr);
			}

			@Override
			public InlineAsmOperand visitInOut(org.stablemir.internal.mir.InlineAsmOperand.InOut inOut) {
				Optional<Operand> inValue = Optional.of(OPERANDS.stable(inOut.inValue(), tables));
				Optional<Place> outPlace = inOut.outPlace().map(place -> PLACES.stable(place, tables));
				return new InlineAsmOperand(inValue, outPlace, rawRepr);
			}

			@Override
			public InlineAsmOperand visitConstOperand(org.stablemir.internal.mir.InlineAsmOperand.ConstOperand constOperand) {
				return opaque();
			}

			@Override
			public InlineAsmOperand visitSymFn(org.stablemir.internal.mir.InlineAsmOperand.SymFn symFn) {
				return opaque();
			}

			@Override
			public InlineAsmOperand visitSymStatic(org.stablemir.internal.mir.InlineAsmOperand.SymStatic symStatic) {
				return opaque();
			}

			private InlineAsmOperand opaque() {
				return new InlineAsmOperand(Optional.empty(), Optional.empty(), rawRepr);
			}
		});
	}
}
