package org.stablemir.api.mir;

/**
 * One arm of a {@link Terminator.SwitchInt}.
 *
 * @param value  The matched value as an unsigned 64-bit pattern; a {@code u64::MAX} arm reads as
 *               {@code -1}. Use {@link #unsignedValue()} to print it.
 * @param target The block jumped to on a match.
 */
public record SwitchTarget(long value, int target) {

    /**
     * @return The matched value in unsigned decimal.
     */
    public String unsignedValue() {
        return Long.toUnsignedString(value);
    }
}
