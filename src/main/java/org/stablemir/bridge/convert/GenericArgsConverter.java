package org.stablemir.bridge.convert;

import org.stablemir.api.ty.GenericArgKind;
import org.stablemir.api.ty.GenericArgs;
import org.stablemir.api.ty.Opaque;
import org.stablemir.bridge.Tables;
import org.stablemir.internal.ty.GenericArg;

import java.util.ArrayList;
import java.util.List;

public final class GenericArgsConverter implements IStableConverter<org.stablemir.internal.ty.GenericArgs, GenericArgs> {

	@Override
	public GenericArgs stable(org.stablemir.internal.ty.GenericArgs args, Tables tables) {
		GenericArg.Visitor<GenericArgKind> visitor = new GenericArg.Visitor<>() {
			@Override
			public GenericArgKind visitLifetime(GenericArg.Lifetime lifetime) {
				return new GenericArgKind.Lifetime(Opaque.of(lifetime.region()));
			}

			@Override
			public GenericArgKind visitType(GenericArg.Type type) {
				return new GenericArgKind.Type(tables.internTy(type.ty()));
			}

			@Override
			public GenericArgKind visitConst(GenericArg.ConstArg constArg) {
				return new GenericArgKind.Const(Opaque.of(constArg.value()));
			}
		};

		List<GenericArgKind> kinds = new ArrayList<>(args.args().size());
		for (GenericArg arg : args.args()) {
			kinds.add(arg.accept(visitor));
		}
		return new GenericArgs(kinds);
	}
}
