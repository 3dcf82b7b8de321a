package org.stablemir.api;

/**
 * Stable handle of a definition, valid for the session that minted it.
 *
 * @param index Position in the session's definition table.
 */
public record DefId(int index) {
}
