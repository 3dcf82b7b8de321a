package org.stablemir.bridge.convert;

import org.stablemir.api.ty.Binder;
import org.stablemir.api.ty.BoundVariableKind;
import org.stablemir.api.ty.FnSig;
import org.stablemir.bridge.Tables;
import org.stablemir.internal.ty.PolyFnSig;

import java.util.ArrayList;
import java.util.List;

import static org.stablemir.bridge.convert.StableConverters.BOUND_VARIABLES;
import static org.stablemir.bridge.convert.StableConverters.FN_SIGS;

/**
 * Wraps a converted signature in a {@link Binder} carrying its late-bound variables.
 */
public final class PolyFnSigConverter implements IStableConverter<PolyFnSig, Binder<FnSig>> {

	@Override
	public Binder<FnSig> stable(PolyFnSig sig, Tables tables) {
		List<BoundVariableKind> boundVars = new ArrayList<>(sig.boundVars().size());
		for (org.stablemir.internal.ty.BoundVariableKind var : sig.boundVars()) {
			boundVars.add(BOUND_VARIABLES.stable(var, tables));
		}
		return new Binder<>(FN_SIGS.stable(sig.sig(), tables), boundVars);
	}
}
