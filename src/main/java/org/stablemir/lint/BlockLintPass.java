package org.stablemir.lint;

import org.stablemir.lint.hir.Block;

import java.util.List;

/**
 * A lint pass that inspects one block at a time. Passes must be stateless between blocks.
 */
public interface BlockLintPass {

    /**
     * @return The lints this pass may emit.
     */
    List<Lint> lints();

    /**
     * Checks a block and reports findings through {@code cx}.
     *
     * @param cx    The context of the current check.
     * @param block The block to check.
     */
    void checkBlock(LintContext cx, Block block);
}
