package org.pragmatica.rsx.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.rsx.error.RsxParseException;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.token.TokenStream;
import org.pragmatica.rsx.tree.Node;

import java.util.List;
import java.util.Optional;

/**
 * Markup parsing engine. Stateless between calls: each parse gets its own {@link ParsingContext},
 * so one engine may serve concurrent callers.
 */
public final class MarkupEngine implements Parser {
    private static final Logger logger = LogManager.getLogger(MarkupEngine.class);

    private final ParserConfig config;

    private MarkupEngine(ParserConfig config) {
        this.config = config;
    }

    public static MarkupEngine create(ParserConfig config) {
        return new MarkupEngine(config);
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public List<Node> parseStrict(TokenStream tokens) throws RsxParseException {
        return run(tokens, config.withStrictMode(true)).orElseThrow();
    }

    @Override
    public ParseOutcome<List<Node>> parseRecoverable(TokenStream tokens) {
        return run(tokens, config);
    }

    private static ParseOutcome<List<Node>> run(TokenStream tokens, ParserConfig config) {
        logger.debug("Parsing {} top level tokens (strict: {})", tokens.tokens()
                                                                         .size(), config.strictMode());
        var ctx = ParsingContext.create(config);
        var nodes = new NodeGrammar(ctx).topLevel(TokenInput.of(tokens.tokens()));
        var diagnostics = ctx.diagnostics();
        if (ctx.isAborted()) {
            logger.debug("Parse aborted: {}", diagnostics.get(diagnostics.size() - 1)
                                                          .formatSimple());
        }
        logger.debug("Parsed {} nodes with {} diagnostics", nodes.size(), diagnostics.size());
        if (config.strictMode() && !diagnostics.isEmpty()) {
            // first error only: the partial tree is discarded
            return new ParseOutcome.Failed<>(List.of(diagnostics.get(0)));
        }
        if (nodes.isEmpty() && !diagnostics.isEmpty()) {
            return new ParseOutcome.Failed<>(diagnostics);
        }
        return ParseOutcome.fromParts(Optional.of(nodes), diagnostics);
    }
}
