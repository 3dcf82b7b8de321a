package org.stablemir.bridge.convert;

import org.stablemir.api.ty.FnSig;
import org.stablemir.api.ty.Ty;
import org.stablemir.bridge.Tables;

import java.util.ArrayList;
import java.util.List;

public final class FnSigConverter implements IStableConverter<org.stablemir.internal.ty.FnSig, FnSig> {

	@Override
	public FnSig stable(org.stablemir.internal.ty.FnSig sig, Tables tables) {
		List<Ty> inputsAndOutput = new ArrayList<>(sig.inputsAndOutput().size());
		for (org.stablemir.internal.ty.Ty ty : sig.inputsAndOutput()) {
			inputsAndOutput.add(tables.internTy(ty));
		}
		return new FnSig(inputsAndOutput, sig.cVariadic(), KindMappings.safety(sig.unsafety()), KindMappings.abi(sig.abi()));
	}
}
