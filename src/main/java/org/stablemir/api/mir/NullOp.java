package org.stablemir.api.mir;

import java.util.List;

public sealed interface NullOp permits NullOp.SizeOf, NullOp.AlignOf, NullOp.OffsetOf {

    record SizeOf() implements NullOp {
    }

    record AlignOf() implements NullOp {
    }

    /**
     * @param fields Field indices from the outermost type inwards.
     */
    record OffsetOf(List<Integer> fields) implements NullOp {
        public OffsetOf {
            fields = List.copyOf(fields);
        }
    }
}
