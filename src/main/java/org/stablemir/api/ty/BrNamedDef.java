package org.stablemir.api.ty;

import org.stablemir.api.DefId;

/**
 * Handle of the definition of a named late-bound lifetime.
 */
public record BrNamedDef(DefId def) {
}
