package org.stablemir.internal.ty;

/**
 * A source range inside a file.
 */
public record Span(String file, int lo, int hi) {

    public static final Span DUMMY = new Span("<dummy>", 0, 0);

    @Override
    public String toString() {
        return file + ":" + lo + "-" + hi;
    }
}
