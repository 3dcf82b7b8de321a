package org.stablemir.api.ty;

public enum UintTy { USIZE, U8, U16, U32, U64, U128 }
