package org.stablemir.api.ty;

public enum FloatTy { F32, F64 }
