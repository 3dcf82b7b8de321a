package org.stablemir.api.ty;

import org.stablemir.api.Context;

/**
 * Handle of an interned type. Valid only inside the session that minted it; use
 * {@link #kind(Context)} to look at its structure.
 *
 * @param id Position in the session's type table.
 */
public record Ty(int id) {

    public TyKind kind(Context context) {
        return context.tyKind(this);
    }
}
