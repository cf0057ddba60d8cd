package org.pragmatica.rsx.token;

import java.util.List;
import java.util.Optional;

/**
 * Fully materialized parser input: the top-level token trees plus, when the host has it, access to source text.
 */
public record TokenStream(List<TokenTree> tokens, Optional<SourceTextProvider> source) {

    public TokenStream {
        tokens = List.copyOf(tokens);
    }

    public static TokenStream of(List<TokenTree> tokens) {
        return new TokenStream(tokens, Optional.empty());
    }

    public static TokenStream of(List<TokenTree> tokens, SourceTextProvider source) {
        return new TokenStream(tokens, Optional.of(source));
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    @Override
    public String toString() {
        return Tokens.toCanonicalString(tokens);
    }
}
