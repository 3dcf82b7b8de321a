package org.stablemir.internal.mir;

import java.util.List;

/**
 * An operation that only depends on a type.
 */
public sealed interface NullOp
        permits NullOp.SizeOf, NullOp.AlignOf, NullOp.OffsetOf {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitSizeOf(SizeOf sizeOf);
        R visitAlignOf(AlignOf alignOf);
        R visitOffsetOf(OffsetOf offsetOf);
    }

    record SizeOf() implements NullOp {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSizeOf(this);
        }
    }

    record AlignOf() implements NullOp {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAlignOf(this);
        }
    }

    /**
     * Byte offset of a (possibly nested) field path.
     */
    record OffsetOf(List<Integer> fields) implements NullOp {
        public OffsetOf {
            fields = List.copyOf(fields);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOffsetOf(this);
        }
    }
}
