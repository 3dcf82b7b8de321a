package org.stablemir.bridge.convert;

import org.stablemir.api.ConversionException;
import org.stablemir.api.mir.Statement;
import org.stablemir.bridge.Tables;
import org.stablemir.internal.mir.StatementKind;

import static org.stablemir.bridge.convert.StableConverters.PLACES;
import static org.stablemir.bridge.convert.StableConverters.RVALUES;

/**
 * Converts statements. Only assignments and no-ops have a stable form so far; every other kind
 * is reported as not yet implemented instead of being dropped.
 */
public final class StatementConverter implements IStableConverter<org.stablemir.internal.mir.Statement, Statement> {

	@Override
	public Statement stable(org.stablemir.internal.mir.Statement statement, Tables tables) {
		return statement.kind().accept(new KindVisitor(tables));
	}

	private static final class KindVisitor implements StatementKind.Visitor<Statement> {

		private final Tables tables;

		KindVisitor(Tables tables) {
			this.tables = tables;
		}

		@Override
		public Statement visitAssign(StatementKind.Assign assign) {
			return new Statement.Assign(PLACES.stable(assign.place(), tables), RVALUES.stable(assign.rvalue(), tables));
		}

		@Override
		public Statement visitFakeRead(StatementKind.FakeRead fakeRead) {
			throw ConversionException.notYetImplemented("StatementKind.FakeRead");
		}

		@Override
		public Statement visitSetDiscriminant(StatementKind.SetDiscriminant setDiscriminant) {
			throw ConversionException.notYetImplemented("StatementKind.SetDiscriminant");
		}

		@Override
		public Statement visitDeinit(StatementKind.Deinit deinit) {
			throw ConversionException.notYetImplemented("StatementKind.Deinit");
		}

		@Override
		public Statement visitStorageLive(StatementKind.StorageLive storageLive) {
			throw ConversionException.notYetImplemented("StatementKind.StorageLive");
		}

		@Override
		public Statement visitStorageDead(StatementKind.StorageDead storageDead) {
			throw ConversionException.notYetImplemented("StatementKind.StorageDead");
		}

		@Override
		public Statement visitRetag(StatementKind.Retag retag) {
			throw ConversionException.notYetImplemented("StatementKind.Retag");
		}

		@Override
		public Statement visitPlaceMention(StatementKind.PlaceMention placeMention) {
			throw ConversionException.notYetImplemented("StatementKind.PlaceMention");
		}

		@Override
		public Statement visitAscribeUserType(StatementKind.AscribeUserType ascribe) {
			throw ConversionException.notYetImplemented("StatementKind.AscribeUserType");
		}

		@Override
		public Statement visitCoverage(StatementKind.Coverage coverage) {
			throw ConversionException.notYetImplemented("StatementKind.Coverage");
		}

		@Override
		public Statement visitIntrinsic(StatementKind.Intrinsic intrinsic) {
			throw ConversionException.notYetImplemented("StatementKind.Intrinsic");
		}

		@Override
		public Statement visitConstEvalCounter(StatementKind.ConstEvalCounter counter) {
			throw ConversionException.notYetImplemented("StatementKind.ConstEvalCounter");
		}

		@Override
		public Statement visitNop(StatementKind.Nop nop) {
			return new Statement.Nop();
		}
	}
}
