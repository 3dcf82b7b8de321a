package org.stablemir.internal.mir;

public sealed interface BorrowKind
        permits BorrowKind.Shared, BorrowKind.Shallow, BorrowKind.Mut {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitShared(Shared shared);
        R visitShallow(Shallow shallow);
        R visitMut(Mut mut);
    }

    record Shared() implements BorrowKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitShared(this);
        }
    }

    /**
     * A borrow that only guards against the borrowed place being mutated by a match guard.
     */
    record Shallow() implements BorrowKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitShallow(this);
        }
    }

    record Mut(MutBorrowKind kind) implements BorrowKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMut(this);
        }
    }
}
