package org.stablemir.api.ty;

import org.stablemir.api.DefId;

/**
 * Handle of a closure definition.
 */
public record ClosureDef(DefId def) {
}
