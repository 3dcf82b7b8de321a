package org.stablemir.bridge.convert;

import org.stablemir.api.ty.BoundRegionKind;
import org.stablemir.api.ty.BoundTyKind;
import org.stablemir.api.ty.BoundVariableKind;
import org.stablemir.api.ty.Opaque;
import org.stablemir.bridge.Tables;

public final class BoundVariableKindConverter
		implements IStableConverter<org.stablemir.internal.ty.BoundVariableKind, BoundVariableKind> {

	@Override
	public BoundVariableKind stable(org.stablemir.internal.ty.BoundVariableKind boundVar, Tables tables) {
		return boundVar.accept(new org.stablemir.internal.ty.BoundVariableKind.Visitor<>() {
			@Override
			public BoundVariableKind visitTy(org.stablemir.internal.ty.BoundVariableKind.TyVar tyVar) {
				return new BoundVariableKind.TyVar(boundTy(tyVar.kind(), tables));
			}

			@Override
			public BoundVariableKind visitRegion(org.stablemir.internal.ty.BoundVariableKind.RegionVar regionVar) {
				return new BoundVariableKind.RegionVar(boundRegion(regionVar.kind(), tables));
			}

			@Override
			public BoundVariableKind visitConst(org.stablemir.internal.ty.BoundVariableKind.ConstVar constVar) {
				return new BoundVariableKind.ConstVar();
			}
		});
	}

	private static BoundTyKind boundTy(org.stablemir.internal.ty.BoundTyKind kind, Tables tables) {
		return kind.accept(new org.stablemir.internal.ty.BoundTyKind.Visitor<>() {
			@Override
			public BoundTyKind visitAnon(org.stablemir.internal.ty.BoundTyKind.Anon anon) {
				return new BoundTyKind.Anon();
			}

			@Override
			public BoundTyKind visitParam(org.stablemir.internal.ty.BoundTyKind.Param param) {
				return new BoundTyKind.Param(tables.paramDef(param.def()), param.name());
			}
		});
	}

	private static BoundRegionKind boundRegion(org.stablemir.internal.ty.BoundRegionKind kind, Tables tables) {
		return kind.accept(new org.stablemir.internal.ty.BoundRegionKind.Visitor<>() {
			@Override
			public BoundRegionKind visitAnon(org.stablemir.internal.ty.BoundRegionKind.BrAnon anon) {
				return new BoundRegionKind.BrAnon(anon.span().map(Opaque::of));
			}

			@Override
			public BoundRegionKind visitNamed(org.stablemir.internal.ty.BoundRegionKind.BrNamed named) {
				return new BoundRegionKind.BrNamed(tables.brNamedDef(named.def()), named.name());
			}

			@Override
			public BoundRegionKind visitEnv(org.stablemir.internal.ty.BoundRegionKind.BrEnv env) {
				return new BoundRegionKind.BrEnv();
			}
		});
	}
}
