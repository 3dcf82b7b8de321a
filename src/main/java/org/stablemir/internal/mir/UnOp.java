package org.stablemir.internal.mir;

public enum UnOp { NOT, NEG }
