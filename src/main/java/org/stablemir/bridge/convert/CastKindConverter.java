package org.stablemir.bridge.convert;

import org.stablemir.api.mir.CastKind;
import org.stablemir.bridge.Tables;

import static org.stablemir.bridge.convert.StableConverters.POINTER_COERCIONS;

public final class CastKindConverter implements IStableConverter<org.stablemir.internal.mir.CastKind, CastKind> {

	@Override
	public CastKind stable(org.stablemir.internal.mir.CastKind kind, Tables tables) {
		return kind.accept(new org.stablemir.internal.mir.CastKind.Visitor<>() {
			@Override
			public CastKind visitSimple(org.stablemir.internal.mir.CastKind.Simple simple) {
				return switch (simple) {
					case POINTER_EXPOSE_ADDRESS -> new CastKind.PointerExposeAddress();
					case POINTER_FROM_EXPOSED_ADDRESS -> new CastKind.PointerFromExposedAddress();
					case DYN_STAR -> new CastKind.DynStar();
					case INT_TO_INT -> new CastKind.IntToInt();
					case FLOAT_TO_INT -> new CastKind.FloatToInt();
					case FLOAT_TO_FLOAT -> new CastKind.FloatToFloat();
					case INT_TO_FLOAT -> new CastKind.IntToFloat();
					case PTR_TO_PTR -> new CastKind.PtrToPtr();
					case FN_PTR_TO_PTR -> new CastKind.FnPtrToPtr();
					case TRANSMUTE -> new CastKind.Transmute();
				};
			}

			@Override
			public CastKind visitPointerCoercion(org.stablemir.internal.mir.CastKind.PointerCoercionCast cast) {
				return new CastKind.PointerCoercionCast(POINTER_COERCIONS.stable(cast.coercion(), tables));
			}
		});
	}
}
