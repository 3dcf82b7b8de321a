package org.stablemir.api;

import org.stablemir.api.mir.Body;

/**
 * A body-bearing definition: a function, a static, a constant or a closure.
 *
 * @param def The definition handle.
 */
public record CrateItem(DefId def) {

    /**
     * @param context The session that minted this item.
     * @return The item's stable body.
     */
    public Body body(Context context) {
        return context.mirBody(this);
    }
}
