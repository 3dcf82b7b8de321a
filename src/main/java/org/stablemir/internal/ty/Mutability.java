package org.stablemir.internal.ty;

public enum Mutability { NOT, MUT }
