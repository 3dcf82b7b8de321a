package org.stablemir.lint.hir;

import org.stablemir.diagnostics.Diagnostic;
import org.stablemir.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses the source of a single block into a {@link Block}. The block may be written with or
 * without surrounding braces.
 * <p>
 * A macro invocation {@code name!(args)} is modeled as a call of the path {@code name!}; every node
 * inside it, and a statement starting with one, carries a span marked as coming from expansion.
 * Syntax errors are reported to the {@link DiagnosticsEngine}; the parser then skips to the next
 * statement.
 */
public class BlockParser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;
    private int expansionDepth = 0;
    private boolean braced;

    /**
     * @param tokens      The tokens from a {@link HirLexer}.
     * @param diagnostics The engine for reporting errors.
     */
    public BlockParser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Lexes and parses {@code source}.
     *
     * @param source      The block source.
     * @param diagnostics The engine for reporting errors.
     * @return The parsed block; statements with syntax errors are left out.
     */
    public static Block parse(String source, DiagnosticsEngine diagnostics) {
        return new BlockParser(new HirLexer(source, diagnostics).scanTokens(), diagnostics).parse();
    }

    /**
     * Parses all tokens as one block.
     * @return The parsed block.
     */
    public Block parse() {
        int lo = peek().lo();
        braced = match(TokenType.LEFT_BRACE);
        List<Stmt> stmts = new ArrayList<>();
        Expr tail = null;

        while (!atBlockEnd()) {
            try {
                if (check(TokenType.LET)) {
                    stmts.add(local());
                    continue;
                }
                boolean macroStatement = check(TokenType.IDENTIFIER) && checkNext(TokenType.BANG);
                if (macroStatement) {
                    expansionDepth++;
                }
                try {
                    int stmtLo = peek().lo();
                    Expr expr = expression();
                    if (match(TokenType.SEMICOLON)) {
                        stmts.add(new Stmt.Semi(expr, span(stmtLo, previous().hi())));
                    } else if (atBlockEnd()) {
                        tail = expr;
                    } else {
                        throw error(peek(), "Expected ';' after expression.");
                    }
                } finally {
                    if (macroStatement) {
                        expansionDepth--;
                    }
                }
            } catch (ParseError e) {
                synchronize();
            }
        }

        if (braced && !match(TokenType.RIGHT_BRACE)) {
            error(peek(), "Expected '}' at end of block.");
        }
        int hi = previous() == null ? lo : previous().hi();
        if (!isAtEnd()) {
            error(peek(), "Unexpected '" + peek().text() + "' after block.");
        }
        return new Block(stmts, Optional.ofNullable(tail), Span.of(lo, Math.max(lo, hi)));
    }

    // --- Statements ---

    private Stmt local() {
        Token let = consume(TokenType.LET, "Expected 'let'.");
        boolean mutable = match(TokenType.MUT);
        Token name = consume(TokenType.IDENTIFIER, "Expected binding name after 'let'.");
        if (match(TokenType.COLON)) {
            skipType();
        }
        Optional<Expr> init = Optional.empty();
        if (match(TokenType.EQUAL)) {
            init = Optional.of(expression());
        }
        consume(TokenType.SEMICOLON, "Expected ';' after let statement.");
        return new Stmt.Local(name.text(), mutable, init, span(let.lo(), previous().hi()));
    }

    private void skipType() {
        int depth = 0;
        while (!isAtEnd()) {
            if (depth == 0 && (check(TokenType.EQUAL) || check(TokenType.SEMICOLON))) {
                return;
            }
            Token token = advance();
            switch (token.type()) {
                case LESS, LEFT_PAREN, LEFT_BRACKET -> depth++;
                case GREATER, RIGHT_PAREN, RIGHT_BRACKET -> depth--;
                default -> {
                }
            }
        }
    }

    // --- Expressions ---

    private Expr expression() {
        return binary(1);
    }

    private Expr binary(int minPrecedence) {
        Expr lhs = cast();
        while (true) {
            int precedence = precedence(peek().type());
            if (precedence < minPrecedence) {
                return lhs;
            }
            Token op = advance();
            Expr rhs = binary(precedence + 1);
            lhs = new Expr.Binary(op.text(), lhs, rhs, span(lhs.span().lo(), rhs.span().hi()));
        }
    }

    private static int precedence(TokenType type) {
        return switch (type) {
            case STAR, SLASH, PERCENT -> 2;
            case PLUS, MINUS -> 1;
            default -> 0;
        };
    }

    private Expr cast() {
        Expr expr = unary();
        while (match(TokenType.AS)) {
            int typeLo = peek().lo();
            skipPathType();
            expr = new Expr.Cast(expr, sourceText(typeLo, previous().hi()), span(expr.span().lo(), previous().hi()));
        }
        return expr;
    }

    private void skipPathType() {
        consume(TokenType.IDENTIFIER, "Expected type after 'as'.");
        while (true) {
            if (check(TokenType.LESS)) {
                skipGenerics();
            } else if (match(TokenType.PATH_SEP)) {
                consume(TokenType.IDENTIFIER, "Expected path segment after '::'.");
            } else {
                return;
            }
        }
    }

    private Expr unary() {
        if (match(TokenType.AMPERSAND)) {
            Token amp = previous();
            boolean mutable = match(TokenType.MUT);
            Expr inner = unary();
            return new Expr.AddrOf(mutable, inner, span(amp.lo(), inner.span().hi()));
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = primary();
        int lo = expr.span().lo();
        while (true) {
            if (match(TokenType.DOT)) {
                Token name = check(TokenType.INTEGER)
                        ? advance()
                        : consume(TokenType.IDENTIFIER, "Expected field or method name after '.'.");
                if (match(TokenType.PATH_SEP)) {
                    skipGenerics();
                }
                if (match(TokenType.LEFT_PAREN)) {
                    List<Expr> args = arguments(TokenType.RIGHT_PAREN);
                    expr = new Expr.MethodCall(name.text(), expr, args, span(lo, previous().hi()));
                } else {
                    expr = new Expr.Field(expr, name.text(), span(lo, previous().hi()));
                }
            } else if (match(TokenType.LEFT_PAREN)) {
                List<Expr> args = arguments(TokenType.RIGHT_PAREN);
                expr = new Expr.Call(expr, args, span(lo, previous().hi()));
            } else if (match(TokenType.QUESTION)) {
                expr = new Expr.Try(expr, span(lo, previous().hi()));
            } else {
                return expr;
            }
        }
    }

    private Expr primary() {
        if (match(TokenType.INTEGER, TokenType.STRING)) {
            Token literal = previous();
            return new Expr.Lit(literal.text(), span(literal.lo(), literal.hi()));
        }
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.BANG)) {
            return macroCall();
        }
        if (match(TokenType.IDENTIFIER)) {
            return path(previous());
        }
        if (match(TokenType.LEFT_PAREN)) {
            Expr inner = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
            return inner;
        }
        throw error(peek(), "Expected expression, but got '" + peek().text() + "'.");
    }

    private Expr path(Token first) {
        List<String> segments = new ArrayList<>();
        segments.add(first.text());
        while (match(TokenType.PATH_SEP)) {
            if (check(TokenType.LESS)) {
                skipGenerics();
            } else {
                segments.add(consume(TokenType.IDENTIFIER, "Expected path segment after '::'.").text());
            }
        }
        return new Expr.Path(segments, span(first.lo(), previous().hi()));
    }

    private Expr macroCall() {
        Token name = advance();
        advance();
        expansionDepth++;
        try {
            TokenType close;
            if (match(TokenType.LEFT_PAREN)) {
                close = TokenType.RIGHT_PAREN;
            } else if (match(TokenType.LEFT_BRACKET)) {
                close = TokenType.RIGHT_BRACKET;
            } else if (match(TokenType.LEFT_BRACE)) {
                close = TokenType.RIGHT_BRACE;
            } else {
                throw error(peek(), "Expected '(', '[' or '{' after macro name.");
            }
            Expr callee = new Expr.Path(List.of(name.text() + "!"), span(name.lo(), name.hi() + 1));
            List<Expr> args = arguments(close);
            return new Expr.Call(callee, args, span(name.lo(), previous().hi()));
        } finally {
            expansionDepth--;
        }
    }

    private List<Expr> arguments(TokenType close) {
        List<Expr> args = new ArrayList<>();
        if (match(close)) {
            return args;
        }
        while (true) {
            args.add(expression());
            if (match(TokenType.COMMA)) {
                if (match(close)) {
                    return args;
                }
                continue;
            }
            consume(close, "Expected ',' or closing delimiter in argument list.");
            return args;
        }
    }

    private void skipGenerics() {
        consume(TokenType.LESS, "Expected '<'.");
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            Token token = advance();
            if (token.type() == TokenType.LESS) {
                depth++;
            } else if (token.type() == TokenType.GREATER) {
                depth--;
            }
        }
    }

    // --- Token handling ---

    private String sourceText(int lo, int hi) {
        StringBuilder text = new StringBuilder();
        for (Token token : tokens) {
            if (token.lo() >= lo && token.hi() <= hi && token.type() != TokenType.END_OF_FILE) {
                text.append(token.text());
            }
        }
        return text.toString();
    }

    private Span span(int lo, int hi) {
        return new Span(lo, hi, expansionDepth > 0);
    }

    private boolean atBlockEnd() {
        return isAtEnd() || (braced && check(TokenType.RIGHT_BRACE));
    }

    private void synchronize() {
        if (!atBlockEnd()) {
            advance();
        }
        while (!atBlockEnd()) {
            if (previous().type() == TokenType.SEMICOLON) return;
            advance();
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return current == 0 ? null : tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(Diagnostic.SYNTAX, message, Span.of(token.lo(), token.hi()));
        return new ParseError(message);
    }

    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message);
        }
    }
}
