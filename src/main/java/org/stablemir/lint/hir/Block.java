package org.stablemir.lint.hir;

import java.util.List;
import java.util.Optional;

/**
 * A block: statements followed by an optional tail expression that gives the block its value.
 */
public record Block(List<Stmt> stmts, Optional<Expr> expr, Span span) {

    public Block {
        stmts = List.copyOf(stmts);
    }
}
