package org.stablemir.internal.mir;

public enum MutBorrowKind {
    DEFAULT,
    /** A borrow that is only activated at its first use, e.g. the receiver of {@code v.push(v.len())}. */
    TWO_PHASE_BORROW,
    /** A unique borrow captured by a closure. */
    CLOSURE_CAPTURE
}
