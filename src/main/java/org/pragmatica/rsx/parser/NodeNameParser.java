package org.pragmatica.rsx.parser;

import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.tree.NodeName;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Element names and attribute keys.
 * <ul>
 *   <li>{@code a::b::c} is a path; a lone identifier is a path of one segment</li>
 *   <li>{@code data-foo}, {@code on:click} and mixes like {@code a-b:c} are punctuated</li>
 *   <li>{@code {expr}} is a dynamic name</li>
 * </ul>
 */
final class NodeNameParser {
    private final BlockParser blocks;

    NodeNameParser(BlockParser blocks) {
        this.blocks = blocks;
    }

    /**
     * A dynamic name whose block the host rejects is kept as an invalid block when invalid blocks are recovered.
     * Otherwise the block parser has already recorded the failure and aborted the parse.
     */
    NodeName parse(TokenInput input) throws SyntaxException {
        if (input.peekBrace()) {
            var block = blocks.block(input);
            if (block.isEmpty()) {
                throw input.error("invalid dynamic name");
            }
            return new NodeName.Dynamic(block.get());
        }
        return parseStaticName(input);
    }

    /**
     * Lookahead form: empty when no well-formed static name starts here.
     */
    Optional<NodeName> parseStatic(TokenInput input) {
        if (!input.peekIdent()) {
            return Optional.empty();
        }
        try{
            return Optional.of(parseStaticName(input));
        } catch (SyntaxException e) {
            // malformed name, so not a match
            return Optional.empty();
        }
    }

    private NodeName parseStaticName(TokenInput input) throws SyntaxException {
        if (!input.peekIdent()) {
            throw input.error("invalid tag name or attribute key");
        }
        if (input.peekPathSeparator(1)) {
            return path(input);
        }
        if (isNameSeparator(input, 1)) {
            return punctuated(input);
        }
        var ident = input.parseIdent();
        return new NodeName.SimplePath(List.of(ident), ident.span());
    }

    private NodeName path(TokenInput input) throws SyntaxException {
        var segments = new ArrayList<TokenTree.Ident>();
        segments.add(input.parseIdent());
        while (input.peekPathSeparator(0)) {
            input.next();
            input.next();
            if (!input.peekIdent()) {
                throw input.error("expected identifier after `::`");
            }
            segments.add(input.parseIdent());
        }
        var span = segments.get(0)
                           .span()
                           .merge(segments.get(segments.size() - 1)
                                          .span());
        return new NodeName.SimplePath(segments, span);
    }

    private NodeName punctuated(TokenInput input) throws SyntaxException {
        var parts = new ArrayList<TokenTree.Ident>();
        var separators = new ArrayList<TokenTree.Punct>();
        parts.add(input.parseIdent());
        while (isNameSeparator(input, 0)) {
            var separator = (TokenTree.Punct) input.next();
            if (!input.peekIdent()) {
                throw input.error("expected identifier after `" + separator.ch() + "`");
            }
            separators.add(separator);
            parts.add(input.parseIdent());
        }
        var span = parts.get(0)
                        .span()
                        .merge(parts.get(parts.size() - 1)
                                    .span());
        return new NodeName.Punctuated(parts, separators, span);
    }

    private static boolean isNameSeparator(TokenInput input, int k) {
        return input.peekPunct(k, '-') || input.peekPunct(k, ':') && !input.peekPathSeparator(k);
    }
}
