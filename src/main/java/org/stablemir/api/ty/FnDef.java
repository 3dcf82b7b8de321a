package org.stablemir.api.ty;

import org.stablemir.api.DefId;

/**
 * Handle of a function definition.
 */
public record FnDef(DefId def) {
}
