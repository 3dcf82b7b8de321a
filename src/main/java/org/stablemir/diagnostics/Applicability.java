package org.stablemir.diagnostics;

/**
 * How confident a suggestion is that applying it yields the code the author meant.
 */
public enum Applicability {
    /** The suggestion is definitely what the author intended and can be applied by a tool. */
    MACHINE_APPLICABLE,
    /** The suggestion may be what the author intended, but it can change behavior. */
    MAYBE_INCORRECT,
    /** The suggestion contains placeholders like {@code (...)} and cannot be applied as-is. */
    HAS_PLACEHOLDERS,
    /** Nothing is known about the suggestion. */
    UNSPECIFIED
}
