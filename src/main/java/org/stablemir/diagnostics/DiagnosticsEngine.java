package org.stablemir.diagnostics;

import org.stablemir.lint.hir.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one check run, so that the parser and the lint passes do not have
 * to know who consumes their findings.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error without a suggestion.
     *
     * @param code    The lint name or {@link Diagnostic#SYNTAX}.
     * @param message The error message.
     * @param span    Where the error is.
     */
    public void reportError(String code, String message, Span span) {
        report(new Diagnostic(Diagnostic.Type.ERROR, code, message, span, Optional.empty()));
    }

    /**
     * Reports a warning without a suggestion.
     *
     * @param code    The lint name.
     * @param message The warning message.
     * @param span    Where the problem is.
     */
    public void reportWarning(String code, String message, Span span) {
        report(new Diagnostic(Diagnostic.Type.WARNING, code, message, span, Optional.empty()));
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @param code A lint name or {@link Diagnostic#SYNTAX}.
     * @return The diagnostics reported under that code, in report order.
     */
    public List<Diagnostic> withCode(String code) {
        return diagnostics.stream()
                .filter(d -> d.code().equals(code))
                .collect(Collectors.toList());
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
