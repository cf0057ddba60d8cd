package org.pragmatica.rsx.token;

import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Parse position over a {@link TokenCursor}. Sub-parsers consume tokens from it; speculative parsing
 * works on a {@link #fork()} and commits with {@link #advanceTo(TokenInput)}.
 */
public final class TokenInput {
    private TokenCursor cursor;

    public TokenInput(TokenCursor cursor) {
        this.cursor = cursor;
    }

    public static TokenInput of(List<TokenTree> tokens) {
        return new TokenInput(TokenCursor.of(tokens));
    }

    public static TokenInput of(List<TokenTree> tokens, SourceSpan endSpan) {
        return new TokenInput(TokenCursor.of(tokens, endSpan));
    }

    /**
     * Input over the contents of a group; its end span is the closing delimiter.
     */
    public static TokenInput inside(TokenTree.Group group) {
        return of(group.tokens(), group.closeSpan());
    }

    public TokenCursor cursor() {
        return cursor;
    }

    public TokenInput fork() {
        return new TokenInput(cursor);
    }

    /**
     * Commit a fork created from this input.
     */
    public void advanceTo(TokenInput fork) {
        this.cursor = fork.cursor;
    }

    public int position() {
        return cursor.index();
    }

    public boolean isEmpty() {
        return cursor.isEmpty();
    }

    public SourceSpan span() {
        return cursor.span();
    }

    public SyntaxException error(String message) {
        return new SyntaxException(message, span());
    }

    // === Lookahead ===

    public Optional<TokenTree> peek() {
        return cursor.current();
    }

    public Optional<TokenTree> peek(int k) {
        return cursor.peek(k);
    }

    public boolean peekPunct(char ch) {
        return peekPunct(0, ch);
    }

    public boolean peekPunct(int k, char ch) {
        return cursor.peek(k)
                     .filter(t -> t instanceof TokenTree.Punct punct && punct.is(ch))
                     .isPresent();
    }

    public boolean peekIdent() {
        return peekIdent(0);
    }

    public boolean peekIdent(int k) {
        return cursor.peek(k)
                     .filter(TokenTree.Ident.class::isInstance)
                     .isPresent();
    }

    public boolean peekBrace() {
        return cursor.current()
                     .filter(t -> t instanceof TokenTree.Group group && group.isBrace())
                     .isPresent();
    }

    public boolean peekStringLiteral() {
        return cursor.current()
                     .filter(t -> t instanceof TokenTree.Literal literal && literal.isString())
                     .isPresent();
    }

    /**
     * Two joint colons forming a path separator at position {@code k}.
     */
    public boolean peekPathSeparator(int k) {
        return cursor.peek(k)
                     .filter(t -> t instanceof TokenTree.Punct punct && punct.is(':') && punct.isJoint())
                     .isPresent() && peekPunct(k + 1, ':');
    }

    // === Consumption ===

    public TokenTree next() throws SyntaxException {
        var token = cursor.current()
                          .orElseThrow(() -> error("unexpected end of input"));
        cursor = cursor.advance();
        return token;
    }

    /**
     * Consume the current token, if any. Used by recovery, where running out of input is not an error.
     */
    public Optional<TokenTree> skip() {
        var token = cursor.current();
        cursor = cursor.advance();
        return token;
    }

    public TokenTree.Punct parsePunct(char ch) throws SyntaxException {
        if (peekPunct(ch)) {
            return (TokenTree.Punct) next();
        }
        throw error("expected `" + ch + "`");
    }

    public Optional<TokenTree.Punct> parseOptionalPunct(char ch) {
        if (!peekPunct(ch)) {
            return Optional.empty();
        }
        var token = (TokenTree.Punct) cursor.current()
                                            .orElseThrow();
        cursor = cursor.advance();
        return Optional.of(token);
    }

    public TokenTree.Ident parseIdent() throws SyntaxException {
        if (peekIdent()) {
            return (TokenTree.Ident) next();
        }
        throw error("expected identifier");
    }

    public TokenTree.Literal parseStringLiteral() throws SyntaxException {
        if (peekStringLiteral()) {
            return (TokenTree.Literal) next();
        }
        throw error("expected string literal");
    }

    public TokenTree.Group parseBrace() throws SyntaxException {
        if (peekBrace()) {
            return (TokenTree.Group) next();
        }
        throw error("expected `{`");
    }

    /**
     * Fail unless every token has been consumed.
     */
    public void expectEnd() throws SyntaxException {
        if (!isEmpty()) {
            throw error("unexpected token");
        }
    }
}
