package org.stablemir.internal.ty;

public enum Unsafety { UNSAFE, NORMAL }
