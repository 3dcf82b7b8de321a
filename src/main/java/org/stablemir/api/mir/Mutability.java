package org.stablemir.api.mir;

public enum Mutability { NOT, MUT }
