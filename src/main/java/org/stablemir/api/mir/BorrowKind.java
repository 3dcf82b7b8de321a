package org.stablemir.api.mir;

public sealed interface BorrowKind permits BorrowKind.Shared, BorrowKind.Shallow, BorrowKind.Mut {

    record Shared() implements BorrowKind {
    }

    record Shallow() implements BorrowKind {
    }

    record Mut(MutBorrowKind kind) implements BorrowKind {
    }
}
