package org.stablemir.bridge.convert;

import org.stablemir.api.mir.PointerCoercion;
import org.stablemir.bridge.Tables;

public final class PointerCoercionConverter
		implements IStableConverter<org.stablemir.internal.mir.PointerCoercion, PointerCoercion> {

	@Override
	public PointerCoercion stable(org.stablemir.internal.mir.PointerCoercion coercion, Tables tables) {
		return coercion.accept(new org.stablemir.internal.mir.PointerCoercion.Visitor<>() {
			@Override
			public PointerCoercion visitSimple(org.stablemir.internal.mir.PointerCoercion.Simple simple) {
				return switch (simple) {
					case REIFY_FN_POINTER -> new PointerCoercion.ReifyFnPointer();
					case UNSAFE_FN_POINTER -> new PointerCoercion.UnsafeFnPointer();
					case MUT_TO_CONST_POINTER -> new PointerCoercion.MutToConstPointer();
					case ARRAY_TO_POINTER -> new PointerCoercion.ArrayToPointer();
					case UNSIZE -> new PointerCoercion.Unsize();
				};
			}

			@Override
			public PointerCoercion visitClosureFnPointer(org.stablemir.internal.mir.PointerCoercion.ClosureFnPointer coercion) {
				return new PointerCoercion.ClosureFnPointer(KindMappings.safety(coercion.unsafety()));
			}
		});
	}
}
