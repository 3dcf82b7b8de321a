package org.stablemir.api.mir;

public enum MutBorrowKind { DEFAULT, TWO_PHASE_BORROW, CLOSURE_CAPTURE }
