package org.stablemir.lint.hir;

/**
 * A half-open character range {@code [lo, hi)} in the checked source.
 *
 * @param lo            Offset of the first character.
 * @param hi            Offset after the last character.
 * @param fromExpansion Whether the code was produced by a macro rather than written directly.
 */
public record Span(int lo, int hi, boolean fromExpansion) {

    public Span {
        if (lo < 0 || hi < lo) {
            throw new IllegalArgumentException("Invalid span " + lo + ".." + hi);
        }
    }

    public static Span of(int lo, int hi) {
        return new Span(lo, hi, false);
    }

    /**
     * @param source The text this span points into.
     * @return The covered text, or {@code null} if the span lies outside {@code source}.
     */
    public String textIn(String source) {
        if (hi > source.length()) {
            return null;
        }
        return source.substring(lo, hi);
    }
}
