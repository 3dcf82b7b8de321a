package org.stablemir.lint;

/**
 * Static description of a lint.
 *
 * @param name         The name used in diagnostics and configuration, e.g. {@code read_zero_byte_vec}.
 * @param defaultLevel The level used when configuration does not name the lint.
 * @param description  One line describing what the lint checks.
 */
public record Lint(String name, LintLevel defaultLevel, String description) {
}
