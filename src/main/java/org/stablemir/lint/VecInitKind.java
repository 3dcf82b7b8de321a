package org.stablemir.lint;

import org.stablemir.lint.hir.Expr;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * How a freshly created, empty {@code Vec} was initialized.
 */
public sealed interface VecInitKind
        permits VecInitKind.New, VecInitKind.Default, VecInitKind.WithConstCapacity, VecInitKind.WithExprCapacity {

    /** {@code Vec::new()} */
    record New() implements VecInitKind {
    }

    /** {@code Vec::default()} */
    record Default() implements VecInitKind {
    }

    /** {@code Vec::with_capacity(n)} with an integer literal {@code n}. */
    record WithConstCapacity(long capacity) implements VecInitKind {
    }

    /** {@code Vec::with_capacity(expr)} with any other argument. */
    record WithExprCapacity(Expr capacity) implements VecInitKind {
    }

    /**
     * @param init The initializer of a binding.
     * @return Its kind, or empty if it does not create an empty {@code Vec}.
     */
    static Optional<VecInitKind> of(Expr init) {
        if (!(init instanceof Expr.Call call) || !(call.callee() instanceof Expr.Path callee)) {
            return Optional.empty();
        }
        if (call.args().isEmpty()) {
            if (callee.endsWith("Vec", "new")) {
                return Optional.of(new New());
            }
            if (callee.endsWith("Vec", "default")) {
                return Optional.of(new Default());
            }
            return Optional.empty();
        }
        if (call.args().size() == 1 && callee.endsWith("Vec", "with_capacity")) {
            Expr capacity = call.args().get(0);
            if (capacity instanceof Expr.Lit lit) {
                OptionalLong value = lit.intValue();
                if (value.isPresent()) {
                    return Optional.of(new WithConstCapacity(value.getAsLong()));
                }
            }
            return Optional.of(new WithExprCapacity(capacity));
        }
        return Optional.empty();
    }
}
