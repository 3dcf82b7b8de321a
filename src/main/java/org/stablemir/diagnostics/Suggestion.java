package org.stablemir.diagnostics;

import org.stablemir.lint.hir.Span;

/**
 * A textual fix attached to a diagnostic.
 *
 * @param span          The source range the replacement is for.
 * @param help          Short help text shown before the replacement, e.g. {@code try}.
 * @param replacement   The text that should replace {@code span}.
 * @param applicability How safe it is to apply the replacement mechanically.
 */
public record Suggestion(
        Span span,
        String help,
        String replacement,
        Applicability applicability
) {
}
