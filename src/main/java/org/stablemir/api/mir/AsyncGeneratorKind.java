package org.stablemir.api.mir;

public enum AsyncGeneratorKind { BLOCK, CLOSURE, FN }
