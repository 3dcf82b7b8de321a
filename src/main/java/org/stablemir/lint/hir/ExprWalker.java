package org.stablemir.lint.hir;

import java.util.function.Predicate;

/**
 * Depth-first search over expressions. The search stops at the first match.
 */
public final class ExprWalker {

    private ExprWalker() {
    }

    public static boolean any(Expr expr, Predicate<Expr> predicate) {
        if (predicate.test(expr)) {
            return true;
        }
        for (Expr child : expr.children()) {
            if (any(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    public static boolean any(Stmt stmt, Predicate<Expr> predicate) {
        if (stmt instanceof Stmt.Local local) {
            return local.init().map(init -> any(init, predicate)).orElse(false);
        }
        return any(((Stmt.Semi) stmt).expr(), predicate);
    }
}
