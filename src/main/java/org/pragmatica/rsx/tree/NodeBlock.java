package org.pragmatica.rsx.tree;

import org.pragmatica.rsx.host.HostExpression;
import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.token.Tokens;

import java.util.List;
import java.util.Optional;

/**
 * Braced host code embedded in markup.
 */
public sealed interface NodeBlock {
    SourceSpan span();

    /**
     * Parsed expression, present only for valid blocks.
     */
    Optional<HostExpression> tryExpression();

    /**
     * Canonical text including the braces.
     */
    String text();

    /**
     * Block accepted by the host parser.
     */
    record Valid(HostExpression expression, SourceSpan span) implements NodeBlock {
        @Override
        public Optional<HostExpression> tryExpression() {
            return Optional.of(expression);
        }

        @Override
        public String text() {
            return TokenTree.Group.of(TokenTree.Delimiter.BRACE, expression.tokens())
                                  .text();
        }
    }

    /**
     * Block the host parser rejected, kept as raw tokens when invalid blocks are recovered.
     *
     * @param tokens content of the group, possibly rewritten by a block transform
     * @param group  the original braced group
     */
    record Invalid(List<TokenTree> tokens, TokenTree.Group group) implements NodeBlock {
        public Invalid {
            tokens = List.copyOf(tokens);
        }

        @Override
        public SourceSpan span() {
            return group.span();
        }

        @Override
        public Optional<HostExpression> tryExpression() {
            return Optional.empty();
        }

        @Override
        public String text() {
            var inner = Tokens.toCanonicalString(tokens);
            return inner.isEmpty()
                   ? "{}"
                   : "{ " + inner + " }";
        }
    }
}
