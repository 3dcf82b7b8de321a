package org.stablemir.api;

/**
 * Why a compiler construct could not be given a stable counterpart.
 */
public enum ConversionErrorCode {
    /** The construct is real and reachable but has no stable form yet. */
    NOT_YET_IMPLEMENTED,
    /** The construct cannot appear in optimized bodies; meeting it means the compiler broke its contract. */
    INVARIANT_VIOLATED
}
