package org.stablemir.diagnostics;

import org.stablemir.lint.hir.Span;

import java.util.Optional;

/**
 * A single message produced while checking a piece of source: a syntax problem or a lint finding.
 *
 * @param type       The severity.
 * @param code       The lint name, or {@link #SYNTAX} for parse errors.
 * @param message    The message.
 * @param span       Where in the source the problem is.
 * @param suggestion An optional fix.
 */
public record Diagnostic(
        Type type,
        String code,
        String message,
        Span span,
        Optional<Suggestion> suggestion
) {
    /** Code of diagnostics reported by the block parser. */
    public static final String SYNTAX = "syntax";

    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem that fails the check. */
        ERROR,
        /** A problem that is reported but does not fail the check. */
        WARNING
    }

    @Override
    public String toString() {
        String text = String.format("[%s] %s at %d..%d: %s", type, code, span.lo(), span.hi(), message);
        return suggestion
                .map(s -> text + " (" + s.help() + ": `" + s.replacement() + "`)")
                .orElse(text);
    }
}
