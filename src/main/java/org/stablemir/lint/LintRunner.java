package org.stablemir.lint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stablemir.config.StableMirConfig;
import org.stablemir.diagnostics.DiagnosticsEngine;
import org.stablemir.lint.hir.Block;
import org.stablemir.lint.hir.BlockParser;

import java.util.List;

/**
 * Runs a fixed set of block lint passes over source text.
 */
public final class LintRunner {

    private static final Logger LOG = LoggerFactory.getLogger(LintRunner.class);

    private final StableMirConfig config;
    private final List<BlockLintPass> passes;

    public LintRunner(StableMirConfig config, List<BlockLintPass> passes) {
        this.config = config;
        this.passes = List.copyOf(passes);
    }

    /**
     * @param config The lint levels to apply.
     * @return A runner with every built-in pass.
     */
    public static LintRunner withBuiltinPasses(StableMirConfig config) {
        return new LintRunner(config, List.of(new ReadZeroByteVec()));
    }

    /**
     * Parses {@code source} as a block and lints it. If the source does not parse, only the syntax
     * errors are returned.
     *
     * @param source The block source.
     * @return The diagnostics of the run.
     */
    public DiagnosticsEngine check(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Block block = BlockParser.parse(source, diagnostics);
        if (diagnostics.hasErrors()) {
            LOG.debug("Skipping lints, block does not parse:\n{}", diagnostics.summary());
            return diagnostics;
        }
        check(source, block, diagnostics);
        return diagnostics;
    }

    /**
     * Lints an already parsed block.
     *
     * @param source      The text the block's spans point into.
     * @param block       The block.
     * @param diagnostics Where findings go.
     */
    public void check(String source, Block block, DiagnosticsEngine diagnostics) {
        LintContext cx = new LintContext(source, diagnostics, config);
        for (BlockLintPass pass : passes) {
            LOG.debug("Running {} over a block of {} statements", pass.getClass().getSimpleName(), block.stmts().size());
            pass.checkBlock(cx, block);
        }
    }
}
