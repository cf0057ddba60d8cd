package org.pragmatica.rsx.parser;

import org.pragmatica.rsx.error.DiagnosticKind;
import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.host.HostExpression;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.tree.NodeBlock;

import java.util.List;
import java.util.Optional;

/**
 * Braced host code. Content goes through the configured block transform, then the host parser,
 * which must consume all of it.
 */
final class BlockParser {
    private final ParsingContext ctx;
    private final ParserConfig config;

    BlockParser(ParsingContext ctx) {
        this.ctx = ctx;
        this.config = ctx.config();
    }

    /**
     * Recoverable block. A rejected block is kept as {@link NodeBlock.Invalid} when invalid blocks are recovered;
     * otherwise the failure aborts the parse.
     */
    Optional<NodeBlock> block(TokenInput input) {
        var braced = ctx.attempt(DiagnosticKind.UNEXPECTED_TOKEN, input::parseBrace);
        if (braced.isEmpty()) {
            return Optional.empty();
        }
        var group = braced.get();
        var tokens = group.tokens();
        try{
            tokens = transformed(group);
            return Optional.of(new NodeBlock.Valid(parseContent(group, tokens), group.span()));
        } catch (SyntaxException e) {
            var diagnostic = e.toDiagnostic(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION)
                              .withSecondaryLabel(group.span(), "in this block");
            if (config.recoverInvalidBlocks()) {
                ctx.record(diagnostic);
                return Optional.of(new NodeBlock.Invalid(tokens, group));
            }
            ctx.recordAndAbort(diagnostic.withHelp("enable invalid block recovery to keep parsing past it"));
            return Optional.empty();
        }
    }

    private List<TokenTree> transformed(TokenTree.Group group) throws SyntaxException {
        if (config.blockTransform()
                  .isEmpty()) {
            return group.tokens();
        }
        return config.blockTransform()
                     .get()
                     .transform(TokenInput.inside(group))
                     .orElse(group.tokens());
    }

    private HostExpression parseContent(TokenTree.Group group, List<TokenTree> tokens) throws SyntaxException {
        var content = TokenInput.of(tokens, group.closeSpan());
        var expression = config.hostParser()
                               .parseBlock(content, group.span());
        content.expectEnd();
        return expression;
    }
}
