package org.stablemir.api.ty;

import org.stablemir.api.DefId;

/**
 * Handle of a generic parameter definition.
 */
public record ParamDef(DefId def) {
}
