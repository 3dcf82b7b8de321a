package org.stablemir.internal.ty;

public enum IntTy { ISIZE, I8, I16, I32, I64, I128 }
