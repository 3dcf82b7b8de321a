package org.stablemir.internal.ty;

/**
 * A compile-time constant. The compiler's value representation is not modeled; only its
 * printed form and its type are.
 *
 * @param rendering The printed value, e.g. {@code 100_usize}.
 * @param ty        The type of the constant.
 */
public record Const(String rendering, Ty ty) {

    @Override
    public String toString() {
        return rendering;
    }
}
