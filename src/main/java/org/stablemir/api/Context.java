package org.stablemir.api;

import org.stablemir.api.mir.Body;
import org.stablemir.api.ty.Ty;
import org.stablemir.api.ty.TyKind;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for tools reading compiler state through stable types.
 * <p>
 * A context is single-threaded. Queries may grow the session's tables even when they look
 * read-only, so a context must never be shared between threads. Every value returned is
 * self-contained except {@link Ty} handles, which need this context to be resolved.
 * <p>
 * Conversion gaps surface as {@link ConversionException}; handles that this context never minted
 * are rejected with {@link IllegalArgumentException}.
 */
public interface Context {

    /**
     * @return The crate being compiled.
     */
    Crate localCrate();

    /**
     * @return One entry per dependency of the local crate. The order carries no meaning.
     */
    List<Crate> externalCrates();

    /**
     * Looks a crate up by exact name, trying the local crate first. When several crates share
     * a name, the first one found wins.
     *
     * @param name The crate name.
     * @return The crate, or empty if no crate has that name.
     */
    Optional<Crate> findCrate(String name);

    /**
     * @return One item per body-bearing definition of the local crate.
     */
    List<CrateItem> allLocalItems();

    /**
     * @return The program entry point, if the local crate has one.
     */
    Optional<CrateItem> entryFn();

    /**
     * Converts the optimized body of an item. Nothing is cached: every call walks the whole body.
     *
     * @param item An item minted by this context.
     * @return The stable body.
     */
    Body mirBody(CrateItem item);

    /**
     * @param ty A handle minted by this context.
     * @return The structural kind of the type.
     */
    TyKind tyKind(Ty ty);
}
