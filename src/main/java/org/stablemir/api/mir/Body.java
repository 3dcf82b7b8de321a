package org.stablemir.api.mir;

import org.stablemir.api.ty.Ty;

import java.util.List;

/**
 * Stable snapshot of a function body. Blocks and locals are addressed by their position.
 */
public record Body(List<BasicBlock> blocks, List<Ty> locals) {

    public Body {
        blocks = List.copyOf(blocks);
        locals = List.copyOf(locals);
    }
}
