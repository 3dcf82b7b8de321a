package org.stablemir.internal.ty;

/**
 * Whether a generator may be moved after it has been resumed once.
 */
public enum Movability { STATIC, MOVABLE }
