package org.stablemir.bridge.convert;

import org.stablemir.api.ConversionException;
import org.stablemir.api.mir.Rvalue;
import org.stablemir.api.ty.Opaque;
import org.stablemir.bridge.Tables;

import static org.stablemir.bridge.convert.StableConverters.BORROW_KINDS;
import static org.stablemir.bridge.convert.StableConverters.CAST_KINDS;
import static org.stablemir.bridge.convert.StableConverters.NULL_OPS;
import static org.stablemir.bridge.convert.StableConverters.OPERANDS;
import static org.stablemir.bridge.convert.StableConverters.PLACES;

/**
 * Converts rvalues. Types appearing in an rvalue are interned into the session; regions stay opaque.
 */
public final class RvalueConverter implements IStableConverter<org.stablemir.internal.mir.Rvalue, Rvalue> {

	@Override
	public Rvalue stable(org.stablemir.internal.mir.Rvalue rvalue, Tables tables) {
		return rvalue.accept(new RvalueVisitor(tables));
	}

	private static final class RvalueVisitor implements org.stablemir.internal.mir.Rvalue.Visitor<Rvalue> {

		private final Tables tables;

		RvalueVisitor(Tables tables) {
			this.tables = tables;
		}

		@Override
		public Rvalue visitUse(org.stablemir.internal.mir.Rvalue.Use use) {
			return new Rvalue.Use(OPERANDS.stable(use.operand(), tables));
		}

		@Override
		public Rvalue visitRepeat(org.stablemir.internal.mir.Rvalue.Repeat repeat) {
			throw ConversionException.notYetImplemented("Rvalue.Repeat");
		}

		@Override
		public Rvalue visitRef(org.stablemir.internal.mir.Rvalue.Ref ref) {
			return new Rvalue.Ref(
					Opaque.of(ref.region()),
					BORROW_KINDS.stable(ref.kind(), tables),
					PLACES.stable(ref.place(), tables));
		}

		@Override
		public Rvalue visitThreadLocalRef(org.stablemir.internal.mir.Rvalue.ThreadLocalRef threadLocalRef) {
			return new Rvalue.ThreadLocalRef(tables.crateItem(threadLocalRef.def()));
		}

		@Override
		public Rvalue visitAddressOf(org.stablemir.internal.mir.Rvalue.AddressOf addressOf) {
			return new Rvalue.AddressOf(KindMappings.mutability(addressOf.mutability()), PLACES.stable(addressOf.place(), tables));
		}

		@Override
		public Rvalue visitLen(org.stablemir.internal.mir.Rvalue.Len len) {
			return new Rvalue.Len(PLACES.stable(len.place(), tables));
		}

		@Override
		public Rvalue visitCast(org.stablemir.internal.mir.Rvalue.Cast cast) {
			return new Rvalue.Cast(
					CAST_KINDS.stable(cast.kind(), tables),
					OPERANDS.stable(cast.operand(), tables),
					tables.internTy(cast.target()));
		}

		@Override
		public Rvalue visitBinaryOp(org.stablemir.internal.mir.Rvalue.BinaryOp binaryOp) {
			return new Rvalue.BinaryOp(
					KindMappings.binOp(binaryOp.op()),
					OPERANDS.stable(binaryOp.lhs(), tables),
					OPERANDS.stable(binaryOp.rhs(), tables));
		}

		@Override
		public Rvalue visitCheckedBinaryOp(org.stablemir.internal.mir.Rvalue.CheckedBinaryOp checkedBinaryOp) {
			return new Rvalue.CheckedBinaryOp(
					KindMappings.binOp(checkedBinaryOp.op()),
					OPERANDS.stable(checkedBinaryOp.lhs(), tables),
					OPERANDS.stable(checkedBinaryOp.rhs(), tables));
		}

		@Override
		public Rvalue visitNullaryOp(org.stablemir.internal.mir.Rvalue.NullaryOp nullaryOp) {
			return new Rvalue.NullaryOp(NULL_OPS.stable(nullaryOp.op(), tables), tables.internTy(nullaryOp.ty()));
		}

		@Override
		public Rvalue visitUnaryOp(org.stablemir.internal.mir.Rvalue.UnaryOp unaryOp) {
			return new Rvalue.UnaryOp(KindMappings.unOp(unaryOp.op()), OPERANDS.stable(unaryOp.operand(), tables));
		}

		@Override
		public Rvalue visitDiscriminant(org.stablemir.internal.mir.Rvalue.Discriminant discriminant) {
			return new Rvalue.Discriminant(PLACES.stable(discriminant.place(), tables));
		}

		@Override
		public Rvalue visitAggregate(org.stablemir.internal.mir.Rvalue.Aggregate aggregate) {
			throw ConversionException.notYetImplemented("Rvalue.Aggregate");
		}

		@Override
		public Rvalue visitShallowInitBox(org.stablemir.internal.mir.Rvalue.ShallowInitBox shallowInitBox) {
			throw ConversionException.notYetImplemented("Rvalue.ShallowInitBox");
		}

		@Override
		public Rvalue visitCopyForDeref(org.stablemir.internal.mir.Rvalue.CopyForDeref copyForDeref) {
			return new Rvalue.CopyForDeref(PLACES.stable(copyForDeref.place(), tables));
		}
	}
}
