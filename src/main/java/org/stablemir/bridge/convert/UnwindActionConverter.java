package org.stablemir.bridge.convert;

import org.stablemir.api.mir.UnwindAction;
import org.stablemir.bridge.Tables;

public final class UnwindActionConverter
		implements IStableConverter<org.stablemir.internal.mir.UnwindAction, UnwindAction> {

	@Override
	public UnwindAction stable(org.stablemir.internal.mir.UnwindAction unwind, Tables tables) {
		return unwind.accept(new org.stablemir.internal.mir.UnwindAction.Visitor<>() {
			@Override
			public UnwindAction visitContinue(org.stablemir.internal.mir.UnwindAction.Continue action) {
				return new UnwindAction.Continue();
			}

			@Override
			public UnwindAction visitUnreachable(org.stablemir.internal.mir.UnwindAction.Unreachable action) {
				return new UnwindAction.Unreachable();
			}

			@Override
			public UnwindAction visitTerminate(org.stablemir.internal.mir.UnwindAction.Terminate action) {
				return new UnwindAction.Terminate();
			}

			@Override
			public UnwindAction visitCleanup(org.stablemir.internal.mir.UnwindAction.Cleanup cleanup) {
				return new UnwindAction.Cleanup(cleanup.block());
			}
		});
	}
}
