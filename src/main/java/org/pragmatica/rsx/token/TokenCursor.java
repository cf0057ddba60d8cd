package org.pragmatica.rsx.token;

import org.pragmatica.rsx.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Immutable position in a token sequence. Advancing returns a new cursor, so forking is just keeping a copy.
 *
 * @param tokens  the token sequence, shared by every cursor derived from it
 * @param index   index of the current token
 * @param endSpan span reported once the sequence is exhausted, usually the closing delimiter of the enclosing group
 */
public record TokenCursor(List<TokenTree> tokens, int index, SourceSpan endSpan) {

    public static TokenCursor of(List<TokenTree> tokens) {
        return new TokenCursor(tokens, 0, tokens.isEmpty()
                                          ? SourceSpan.UNKNOWN
                                          : tokens.get(tokens.size() - 1)
                                                  .span()
                                                  .endPoint());
    }

    public static TokenCursor of(List<TokenTree> tokens, SourceSpan endSpan) {
        return new TokenCursor(tokens, 0, endSpan);
    }

    public boolean isEmpty() {
        return index >= tokens.size();
    }

    /**
     * Token {@code k} positions ahead; {@code peek(0)} is the current token.
     */
    public Optional<TokenTree> peek(int k) {
        int at = index + k;
        return at < tokens.size()
               ? Optional.of(tokens.get(at))
               : Optional.empty();
    }

    public Optional<TokenTree> current() {
        return peek(0);
    }

    public TokenCursor advance() {
        return isEmpty()
               ? this
               : new TokenCursor(tokens, index + 1, endSpan);
    }

    /**
     * Span of the current token, or the end span when exhausted.
     */
    public SourceSpan span() {
        return isEmpty()
               ? endSpan
               : tokens.get(index)
                       .span();
    }

    /**
     * Tokens between this cursor and a later cursor over the same sequence.
     */
    public List<TokenTree> until(TokenCursor later) {
        return tokens.subList(index, Math.max(index, later.index));
    }

    public List<TokenTree> remaining() {
        return tokens.subList(Math.min(index, tokens.size()), tokens.size());
    }
}
