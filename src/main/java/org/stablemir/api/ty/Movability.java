package org.stablemir.api.ty;

public enum Movability { STATIC, MOVABLE }
