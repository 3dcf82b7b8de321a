package org.stablemir.bridge.convert;

import org.stablemir.api.mir.NullOp;
import org.stablemir.bridge.Tables;

public final class NullOpConverter implements IStableConverter<org.stablemir.internal.mir.NullOp, NullOp> {

	@Override
	public NullOp stable(org.stablemir.internal.mir.NullOp op, Tables tables) {
		return op.accept(new org.stablemir.internal.mir.NullOp.Visitor<>() {
			@Override
			public NullOp visitSizeOf(org.stablemir.internal.mir.NullOp.SizeOf sizeOf) {
				return new NullOp.SizeOf();
			}

			@Override
			public NullOp visitAlignOf(org.stablemir.internal.mir.NullOp.AlignOf alignOf) {
				return new NullOp.AlignOf();
			}

			@Override
			public NullOp visitOffsetOf(org.stablemir.internal.mir.NullOp.OffsetOf offsetOf) {
				return new NullOp.OffsetOf(offsetOf.fields());
			}
		});
	}
}
