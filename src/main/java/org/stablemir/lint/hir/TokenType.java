package org.stablemir.lint.hir;

/**
 * Defines the different types of tokens that the {@link HirLexer} can recognize.
 */
public enum TokenType {
    // Punctuation.
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACE, RIGHT_BRACE,
    LEFT_BRACKET, RIGHT_BRACKET,
    LESS, GREATER,
    COMMA, DOT, SEMICOLON, COLON, PATH_SEP,
    EQUAL, AMPERSAND, BANG, QUESTION,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // Literals.
    IDENTIFIER,
    INTEGER,
    STRING,

    // Keywords.
    LET, MUT, AS,

    /** Represents the end of the source. */
    END_OF_FILE
}
