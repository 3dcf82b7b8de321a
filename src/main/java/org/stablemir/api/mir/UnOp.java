package org.stablemir.api.mir;

public enum UnOp { NOT, NEG }
