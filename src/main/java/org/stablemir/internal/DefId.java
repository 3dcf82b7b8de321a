package org.stablemir.internal;

/**
 * Compiler-side identity of a definition. Only meaningful for the compilation that produced it.
 *
 * @param krate The crate owning the definition.
 * @param index The definition index within its crate.
 */
public record DefId(CrateNum krate, int index) {

    /**
     * Shorthand for a definition in the local crate.
     * @param index The definition index.
     * @return The local definition id.
     */
    public static DefId local(int index) {
        return new DefId(CrateNum.LOCAL_CRATE, index);
    }

    @Override
    public String toString() {
        return "DefId(" + krate.value() + ":" + index + ")";
    }
}
