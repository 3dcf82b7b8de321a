package org.stablemir.lint.hir;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * An expression. Only the shapes the lints look at are modeled.
 */
public sealed interface Expr
        permits Expr.Path, Expr.Lit, Expr.Call, Expr.MethodCall, Expr.AddrOf, Expr.Field, Expr.Try,
        Expr.Binary, Expr.Cast {

    Span span();

    /**
     * @return The directly nested expressions, in source order.
     */
    List<Expr> children();

    /**
     * A path such as {@code v} or {@code Vec::with_capacity}. Generic arguments are not kept.
     */
    record Path(List<String> segments, Span span) implements Expr {
        public Path {
            segments = List.copyOf(segments);
        }

        /**
         * @return {@code true} if this is the plain, single-segment name {@code name}.
         */
        public boolean isLocal(String name) {
            return segments.size() == 1 && segments.get(0).equals(name);
        }

        /**
         * @return {@code true} if the last segments are exactly {@code tail}.
         */
        public boolean endsWith(String... tail) {
            if (tail.length > segments.size()) {
                return false;
            }
            int offset = segments.size() - tail.length;
            for (int i = 0; i < tail.length; i++) {
                if (!segments.get(offset + i).equals(tail[i])) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    /**
     * A literal, kept as written, e.g. {@code 100usize} or {@code "x"}.
     */
    record Lit(String text, Span span) implements Expr {
        /**
         * @return The value of an integer literal, ignoring digit separators and a type suffix.
         */
        public OptionalLong intValue() {
            String digits = text.replace("_", "");
            int end = 0;
            while (end < digits.length() && Character.isDigit(digits.charAt(end))) {
                end++;
            }
            if (end == 0) {
                return OptionalLong.empty();
            }
            String suffix = digits.substring(end);
            if (!suffix.isEmpty() && !suffix.matches("[iu](8|16|32|64|128|size)")) {
                return OptionalLong.empty();
            }
            try {
                return OptionalLong.of(Long.parseLong(digits.substring(0, end)));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    record Call(Expr callee, List<Expr> args, Span span) implements Expr {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>(args.size() + 1);
            children.add(callee);
            children.addAll(args);
            return children;
        }
    }

    record MethodCall(String method, Expr receiver, List<Expr> args, Span span) implements Expr {
        public MethodCall {
            args = List.copyOf(args);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>(args.size() + 1);
            children.add(receiver);
            children.addAll(args);
            return children;
        }
    }

    /**
     * {@code &inner} or {@code &mut inner}.
     */
    record AddrOf(boolean mutable, Expr inner, Span span) implements Expr {
        @Override
        public List<Expr> children() {
            return List.of(inner);
        }
    }

    record Field(Expr base, String name, Span span) implements Expr {
        @Override
        public List<Expr> children() {
            return List.of(base);
        }
    }

    /**
     * {@code inner?}
     */
    record Try(Expr inner, Span span) implements Expr {
        @Override
        public List<Expr> children() {
            return List.of(inner);
        }
    }

    /**
     * An arithmetic operation such as {@code len * 2}.
     *
     * @param op The operator as written, e.g. {@code *}.
     */
    record Binary(String op, Expr lhs, Expr rhs, Span span) implements Expr {
        @Override
        public List<Expr> children() {
            return List.of(lhs, rhs);
        }
    }

    /**
     * {@code inner as Type}. The target type is kept as written.
     */
    record Cast(Expr inner, String type, Span span) implements Expr {
        @Override
        public List<Expr> children() {
            return List.of(inner);
        }
    }
}
