package org.stablemir.internal;

import org.stablemir.internal.mir.Body;

import java.util.List;
import java.util.Optional;

/**
 * The compiler queries the stable layer reads from. Implementations belong to the compiler; the
 * stable layer never mutates anything it obtains here.
 */
public interface CompilerContext {

    /**
     * @return All crates the local crate depends on, excluding the local crate itself.
     */
    List<CrateNum> crates();

    /**
     * @param crateNum A crate number from {@link #crates()} or {@link CrateNum#LOCAL_CRATE}.
     * @return The crate's name.
     */
    String crateName(CrateNum crateNum);

    /**
     * @return Every local definition that owns a body, in the compiler's enumeration order.
     */
    List<DefId> mirKeys();

    /**
     * @return The program's entry point, if the local crate defines one.
     */
    Optional<DefId> entryFn();

    /**
     * @param defId A body owner.
     * @return The optimized body of the definition.
     */
    Body optimizedMir(DefId defId);
}
