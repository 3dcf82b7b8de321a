package org.stablemir.lint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stablemir.diagnostics.Applicability;
import org.stablemir.lint.hir.Block;
import org.stablemir.lint.hir.Expr;
import org.stablemir.lint.hir.ExprWalker;
import org.stablemir.lint.hir.Span;
import org.stablemir.lint.hir.Stmt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Catches reads into a {@code Vec} that was just created empty.
 * <p>
 * {@code read} fills as many bytes as the buffer is long, not as large as its capacity, so
 * {@code let mut v = Vec::with_capacity(100); f.read(&mut v);} reads nothing. Only the statement
 * directly after the binding (or the block's tail expression, if the binding is the last statement)
 * is inspected, and neither of the two may come from a macro expansion.
 */
public final class ReadZeroByteVec implements BlockLintPass {

    private static final Logger LOG = LoggerFactory.getLogger(ReadZeroByteVec.class);

    public static final Lint READ_ZERO_BYTE_VEC = new Lint(
            "read_zero_byte_vec",
            LintLevel.DENY,
            "checks for reads into a zero-length `Vec`");

    static final String MESSAGE = "reading zero byte data to `Vec`";

    private static final Set<String> READ_METHODS = Set.of("read", "read_exact");

    @Override
    public List<Lint> lints() {
        return List.of(READ_ZERO_BYTE_VEC);
    }

    @Override
    public void checkBlock(LintContext cx, Block block) {
        List<Stmt> stmts = block.stmts();
        for (int idx = 0; idx < stmts.size(); idx++) {
            Stmt stmt = stmts.get(idx);
            if (stmt.span().fromExpansion() || !(stmt instanceof Stmt.Local local) || local.init().isEmpty()) {
                continue;
            }
            Optional<VecInitKind> initKind = VecInitKind.of(local.init().get());
            if (initKind.isEmpty()) {
                continue;
            }

            Span nextSpan;
            boolean readFound;
            if (idx == stmts.size() - 1) {
                if (block.expr().isEmpty()) {
                    return;
                }
                Expr tail = block.expr().get();
                readFound = ExprWalker.any(tail, expr -> readsInto(expr, local.name()));
                nextSpan = tail.span();
            } else {
                Stmt next = stmts.get(idx + 1);
                readFound = ExprWalker.any(next, expr -> readsInto(expr, local.name()));
                nextSpan = next.span();
            }

            if (readFound && !nextSpan.fromExpansion()) {
                LOG.trace("Read into empty Vec `{}` at {}..{}", local.name(), nextSpan.lo(), nextSpan.hi());
                emit(cx, local.name(), initKind.get(), nextSpan);
            }
        }
    }

    /**
     * Matches {@code _.read(&mut name)} and {@code _.read_exact(&mut name)}.
     */
    private static boolean readsInto(Expr expr, String name) {
        return expr instanceof Expr.MethodCall call
                && READ_METHODS.contains(call.method())
                && call.args().size() == 1
                && call.args().get(0) instanceof Expr.AddrOf addrOf
                && addrOf.mutable()
                && addrOf.inner() instanceof Expr.Path path
                && path.isLocal(name);
    }

    private static void emit(LintContext cx, String name, VecInitKind initKind, Span span) {
        String capacity;
        if (initKind instanceof VecInitKind.WithConstCapacity constCapacity) {
            capacity = Long.toString(constCapacity.capacity());
        } else if (initKind instanceof VecInitKind.WithExprCapacity exprCapacity) {
            capacity = cx.snippet(exprCapacity.capacity().span(), "..");
        } else {
            cx.spanLint(READ_ZERO_BYTE_VEC, span, MESSAGE);
            return;
        }
        String replacement = name + ".resize(" + capacity + ", 0); " + cx.snippet(span, "..");
        cx.spanLintAndSugg(READ_ZERO_BYTE_VEC, span, MESSAGE, "try", replacement, Applicability.MAYBE_INCORRECT);
    }
}
