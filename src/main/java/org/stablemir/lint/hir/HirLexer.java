package org.stablemir.lint.hir;

import org.stablemir.diagnostics.Diagnostic;
import org.stablemir.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits block source text into tokens. Unknown characters are reported and skipped.
 */
public class HirLexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * @param source      The source text.
     * @param diagnostics The engine for reporting errors.
     */
    public HirLexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return The recognized tokens, ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", source.length(), source.length()));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '<': addToken(TokenType.LESS); break;
            case '>': addToken(TokenType.GREATER); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '=': addToken(TokenType.EQUAL); break;
            case '&': addToken(TokenType.AMPERSAND); break;
            case '!': addToken(TokenType.BANG); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case ':':
                addToken(match(':') ? TokenType.PATH_SEP : TokenType.COLON);
                break;
            case '"': string(); break;
            case '/':
                if (match('/')) {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case ' ', '\r', '\t', '\n':
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    unexpected(c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        switch (text) {
            case "let" -> addToken(TokenType.LET);
            case "mut" -> addToken(TokenType.MUT);
            case "as" -> addToken(TokenType.AS);
            default -> addToken(TokenType.IDENTIFIER);
        }
    }

    private void number() {
        // Digits, separators and a type suffix such as `usize`.
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.INTEGER);
    }

    private void string() {
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\\' && current + 1 < source.length()) {
                advance();
            }
            advance();
        }
        if (isAtEnd()) {
            diagnostics.reportError(Diagnostic.SYNTAX, "Unterminated string.", Span.of(start, current));
            return;
        }
        advance();
        addToken(TokenType.STRING);
    }

    private void unexpected(char c) {
        diagnostics.reportError(Diagnostic.SYNTAX, "Unexpected character: " + c, Span.of(start, current));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), start, current));
    }
}
