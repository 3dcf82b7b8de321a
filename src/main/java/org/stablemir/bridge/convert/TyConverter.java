package org.stablemir.bridge.convert;

import org.stablemir.api.ConversionException;
import org.stablemir.api.ty.Opaque;
import org.stablemir.api.ty.RigidTy;
import org.stablemir.api.ty.Ty;
import org.stablemir.api.ty.TyKind;
import org.stablemir.bridge.Tables;

import java.util.ArrayList;
import java.util.List;

import static org.stablemir.bridge.convert.StableConverters.GENERIC_ARGS;
import static org.stablemir.bridge.convert.StableConverters.POLY_FN_SIGS;

/**
 * Converts one level of a compiler type. Component types are interned, not converted, so a
 * recursive type is only unfolded as far as the caller asks through {@link Tables#tyKind}.
 */
public final class TyConverter implements IStableConverter<org.stablemir.internal.ty.Ty, TyKind> {

	@Override
	public TyKind stable(org.stablemir.internal.ty.Ty ty, Tables tables) {
		return new TyKind.Rigid(ty.kind().accept(new KindVisitor(tables)));
	}

	private static final class KindVisitor implements org.stablemir.internal.ty.TyKind.Visitor<RigidTy> {

		private final Tables tables;

		KindVisitor(Tables tables) {
			this.tables = tables;
		}

		// --- Scalars ---

		@Override
		public RigidTy visitBool(org.stablemir.internal.ty.TyKind.Bool kind) {
			return new RigidTy.Bool();
		}

		@Override
		public RigidTy visitChar(org.stablemir.internal.ty.TyKind.Char kind) {
			return new RigidTy.Char();
		}

		@Override
		public RigidTy visitInt(org.stablemir.internal.ty.TyKind.Int kind) {
			return new RigidTy.Int(KindMappings.intTy(kind.intTy()));
		}

		@Override
		public RigidTy visitUint(org.stablemir.internal.ty.TyKind.Uint kind) {
			return new RigidTy.Uint(KindMappings.uintTy(kind.uintTy()));
		}

		@Override
		public RigidTy visitFloat(org.stablemir.internal.ty.TyKind.Float kind) {
			return new RigidTy.Float(KindMappings.floatTy(kind.floatTy()));
		}

		@Override
		public RigidTy visitStr(org.stablemir.internal.ty.TyKind.Str kind) {
			return new RigidTy.Str();
		}

		@Override
		public RigidTy visitNever(org.stablemir.internal.ty.TyKind.Never kind) {
			return new RigidTy.Never();
		}

		// --- Definitions ---

		@Override
		public RigidTy visitAdt(org.stablemir.internal.ty.TyKind.Adt kind) {
			return new RigidTy.Adt(tables.adtDef(kind.adtDef()), GENERIC_ARGS.stable(kind.args(), tables));
		}

		@Override
		public RigidTy visitForeign(org.stablemir.internal.ty.TyKind.Foreign kind) {
			return new RigidTy.Foreign(tables.foreignDef(kind.def()));
		}

		@Override
		public RigidTy visitFnDef(org.stablemir.internal.ty.TyKind.FnDef kind) {
			return new RigidTy.FnItem(tables.fnDef(kind.def()), GENERIC_ARGS.stable(kind.args(), tables));
		}

		@Override
		public RigidTy visitClosure(org.stablemir.internal.ty.TyKind.Closure kind) {
			return new RigidTy.Closure(tables.closureDef(kind.def()), GENERIC_ARGS.stable(kind.args(), tables));
		}

		@Override
		public RigidTy visitGenerator(org.stablemir.internal.ty.TyKind.Generator kind) {
			return new RigidTy.Generator(
					tables.generatorDef(kind.def()),
					GENERIC_ARGS.stable(kind.args(), tables),
					KindMappings.movability(kind.movability()));
		}

		// --- Compound ---

		@Override
		public RigidTy visitArray(org.stablemir.internal.ty.TyKind.Array kind) {
			return new RigidTy.Array(tables.internTy(kind.element()), Opaque.of(kind.length()));
		}

		@Override
		public RigidTy visitSlice(org.stablemir.internal.ty.TyKind.Slice kind) {
			return new RigidTy.Slice(tables.internTy(kind.element()));
		}

		@Override
		public RigidTy visitRawPtr(org.stablemir.internal.ty.TyKind.RawPtr kind) {
			return new RigidTy.RawPtr(tables.internTy(kind.pointee()), KindMappings.mutability(kind.mutability()));
		}

		@Override
		public RigidTy visitRef(org.stablemir.internal.ty.TyKind.Ref kind) {
			return new RigidTy.Ref(
					Opaque.of(kind.region()),
					tables.internTy(kind.referent()),
					KindMappings.mutability(kind.mutability()));
		}

		@Override
		public RigidTy visitFnPtr(org.stablemir.internal.ty.TyKind.FnPtr kind) {
			return new RigidTy.FnPtr(POLY_FN_SIGS.stable(kind.sig(), tables));
		}

		@Override
		public RigidTy visitTuple(org.stablemir.internal.ty.TyKind.Tuple kind) {
			List<Ty> fields = new ArrayList<>(kind.fields().size());
			for (org.stablemir.internal.ty.Ty field : kind.fields()) {
				fields.add(tables.internTy(field));
			}
			return new RigidTy.Tuple(fields);
		}

		// --- Not yet representable ---

		@Override
		public RigidTy visitDynamic(org.stablemir.internal.ty.TyKind.Dynamic kind) {
			throw ConversionException.notYetImplemented("TyKind.Dynamic");
		}

		@Override
		public RigidTy visitAlias(org.stablemir.internal.ty.TyKind.Alias kind) {
			throw ConversionException.notYetImplemented("TyKind.Alias");
		}

		@Override
		public RigidTy visitParam(org.stablemir.internal.ty.TyKind.Param kind) {
			throw ConversionException.notYetImplemented("TyKind.Param");
		}

		@Override
		public RigidTy visitBound(org.stablemir.internal.ty.TyKind.Bound kind) {
			throw ConversionException.notYetImplemented("TyKind.Bound");
		}

		// --- Never reach optimized MIR ---

		@Override
		public RigidTy visitGeneratorWitness(org.stablemir.internal.ty.TyKind.GeneratorWitness kind) {
			throw ConversionException.invariantViolated("TyKind.GeneratorWitness");
		}

		@Override
		public RigidTy visitGeneratorWitnessMir(org.stablemir.internal.ty.TyKind.GeneratorWitnessMir kind) {
			throw ConversionException.invariantViolated("TyKind.GeneratorWitnessMir");
		}

		@Override
		public RigidTy visitPlaceholder(org.stablemir.internal.ty.TyKind.Placeholder kind) {
			throw ConversionException.invariantViolated("TyKind.Placeholder");
		}

		@Override
		public RigidTy visitInfer(org.stablemir.internal.ty.TyKind.Infer kind) {
			throw ConversionException.invariantViolated("TyKind.Infer");
		}

		@Override
		public RigidTy visitError(org.stablemir.internal.ty.TyKind.Error kind) {
			throw ConversionException.invariantViolated("TyKind.Error");
		}
	}
}
