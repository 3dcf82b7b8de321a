package org.stablemir.api.ty;

/**
 * Display-only stand-in for a compiler value that has no stable structure yet, such as a
 * lifetime or a constant. Two opaque values compare by their rendering and nothing else; callers
 * must not parse the rendering.
 *
 * @param rendering The compiler's printed form of the value.
 */
public record Opaque(String rendering) {

    /**
     * @param value Any compiler value.
     * @return Its printed form wrapped as an opaque token.
     */
    public static Opaque of(Object value) {
        return new Opaque(String.valueOf(value));
    }

    @Override
    public String toString() {
        return rendering;
    }
}
