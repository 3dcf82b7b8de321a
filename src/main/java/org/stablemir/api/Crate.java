package org.stablemir.api;

/**
 * Snapshot of a crate: the one being compiled or one of its dependencies.
 *
 * @param id      The crate number.
 * @param name    The crate name; not necessarily unique.
 * @param isLocal Whether this is the crate being compiled.
 */
public record Crate(int id, String name, boolean isLocal) {
}
