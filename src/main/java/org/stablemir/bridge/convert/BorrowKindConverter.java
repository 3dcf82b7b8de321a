package org.stablemir.bridge.convert;

import org.stablemir.api.mir.BorrowKind;
import org.stablemir.bridge.Tables;

public final class BorrowKindConverter implements IStableConverter<org.stablemir.internal.mir.BorrowKind, BorrowKind> {

	@Override
	public BorrowKind stable(org.stablemir.internal.mir.BorrowKind kind, Tables tables) {
		return kind.accept(new org.stablemir.internal.mir.BorrowKind.Visitor<>() {
			@Override
			public BorrowKind visitShared(org.stablemir.internal.mir.BorrowKind.Shared shared) {
				return new BorrowKind.Shared();
			}

			@Override
			public BorrowKind visitShallow(org.stablemir.internal.mir.BorrowKind.Shallow shallow) {
				return new BorrowKind.Shallow();
			}

			@Override
			public BorrowKind visitMut(org.stablemir.internal.mir.BorrowKind.Mut mut) {
				return new BorrowKind.Mut(KindMappings.mutBorrowKind(mut.kind()));
			}
		});
	}
}
