package org.stablemir.api.ty;

import org.stablemir.api.DefId;

/**
 * Handle of a generator definition.
 */
public record GeneratorDef(DefId def) {
}
