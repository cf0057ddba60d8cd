package org.pragmatica.rsx.host;

import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Opaque handle to an embedded host-language expression or block, as produced by a {@link HostExpressionParser}.
 */
public interface HostExpression {

    /**
     * Tokens the expression was parsed from; for blocks, the content between the braces.
     */
    List<TokenTree> tokens();

    SourceSpan span();

    /**
     * Value of the expression when it is exactly one string literal.
     */
    default Optional<String> stringValue() {
        var tokens = tokens();
        if (tokens.size() == 1 && tokens.get(0) instanceof TokenTree.Literal literal && literal.isString()) {
            return Optional.of(literal.value());
        }
        return Optional.empty();
    }
}
