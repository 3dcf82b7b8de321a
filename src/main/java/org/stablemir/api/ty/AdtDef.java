package org.stablemir.api.ty;

import org.stablemir.api.DefId;

/**
 * Handle of a struct, enum or union definition.
 */
public record AdtDef(DefId def) {
}
