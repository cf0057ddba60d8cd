package org.pragmatica.rsx.host;

import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.token.TokenTree;

import java.util.List;
import java.util.Optional;

/**
 * Hook that sees the content of every code block before the host parser does.
 * <p>
 * Returning tokens replaces the block content; those tokens must form a complete block. Returning empty
 * keeps the original content, which is parsed from the start no matter how far the hook advanced its input.
 * <pre>{@code
 * BlockTransform percent = content -> {
 *     content.parsePunct('%');
 *     return Optional.of(List.of(TokenTree.Literal.string("percent")));
 * };
 * }</pre>
 */
@FunctionalInterface
public interface BlockTransform {
    Optional<List<TokenTree>> transform(TokenInput content) throws SyntaxException;
}
