package org.stablemir.internal.mir;

/**
 * Origin of a generator body: one of the three async lowerings or a plain generator.
 */
public enum GeneratorKind { ASYNC_BLOCK, ASYNC_CLOSURE, ASYNC_FN, GEN }
