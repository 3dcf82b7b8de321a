package org.stablemir.lint;

import org.stablemir.config.StableMirConfig;
import org.stablemir.diagnostics.Applicability;
import org.stablemir.diagnostics.Diagnostic;
import org.stablemir.diagnostics.DiagnosticsEngine;
import org.stablemir.diagnostics.Suggestion;
import org.stablemir.lint.hir.Span;

import java.util.Optional;

/**
 * What a lint pass sees of the current check: the source text, the configured lint levels and the
 * sink for diagnostics.
 */
public final class LintContext {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final StableMirConfig config;

    public LintContext(String source, DiagnosticsEngine diagnostics, StableMirConfig config) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.config = config;
    }

    /**
     * @param span     A span into the checked source.
     * @param fallback Text used when the span cannot be resolved.
     * @return The source text covered by {@code span}.
     */
    public String snippet(Span span, String fallback) {
        String text = span.textIn(source);
        return text == null ? fallback : text;
    }

    public LintLevel level(Lint lint) {
        return config.lintLevel(lint.name(), lint.defaultLevel());
    }

    /**
     * Emits a lint without a suggestion, at the lint's configured level.
     */
    public void spanLint(Lint lint, Span span, String message) {
        emit(lint, span, message, Optional.empty());
    }

    /**
     * Emits a lint with a replacement for {@code span}, at the lint's configured level.
     */
    public void spanLintAndSugg(Lint lint, Span span, String message, String help, String replacement,
                                Applicability applicability) {
        emit(lint, span, message, Optional.of(new Suggestion(span, help, replacement, applicability)));
    }

    private void emit(Lint lint, Span span, String message, Optional<Suggestion> suggestion) {
        LintLevel level = level(lint);
        if (level == LintLevel.ALLOW) {
            return;
        }
        Diagnostic.Type type = level == LintLevel.DENY ? Diagnostic.Type.ERROR : Diagnostic.Type.WARNING;
        diagnostics.report(new Diagnostic(type, lint.name(), message, span, suggestion));
    }
}
