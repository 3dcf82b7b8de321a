package org.stablemir.internal.ty;

public enum FloatTy { F32, F64 }
