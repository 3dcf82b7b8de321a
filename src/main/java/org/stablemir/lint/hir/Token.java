package org.stablemir.lint.hir;

/**
 * A token of the checked source.
 *
 * @param type The type of the token.
 * @param text The exact text of the token.
 * @param lo   Offset of its first character.
 * @param hi   Offset after its last character.
 */
public record Token(TokenType type, String text, int lo, int hi) {
}
