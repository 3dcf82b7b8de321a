package org.stablemir.internal;

/**
 * Compiler-side crate number. Number {@code 0} is always the crate being compiled.
 *
 * @param value The raw crate number.
 */
public record CrateNum(int value) {

    /** The crate currently being compiled. */
    public static final CrateNum LOCAL_CRATE = new CrateNum(0);

    public CrateNum {
        if (value < 0) {
            throw new IllegalArgumentException("Crate number must not be negative: " + value);
        }
    }

    public boolean isLocal() {
        return value == 0;
    }

    @Override
    public String toString() {
        return "crate" + value;
    }
}
