package org.stablemir.lint.hir;

import java.util.Optional;

/**
 * A statement of a block. The span of a statement includes its terminating semicolon.
 */
public sealed interface Stmt permits Stmt.Local, Stmt.Semi {

    Span span();

    /**
     * {@code let [mut] name [: type] [= init];}
     */
    record Local(String name, boolean mutable, Optional<Expr> init, Span span) implements Stmt {
    }

    /**
     * An expression followed by a semicolon.
     */
    record Semi(Expr expr, Span span) implements Stmt {
    }
}
