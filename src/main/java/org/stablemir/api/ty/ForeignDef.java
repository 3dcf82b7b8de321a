package org.stablemir.api.ty;

import org.stablemir.api.DefId;

/**
 * Handle of an extern type definition.
 */
public record ForeignDef(DefId def) {
}
