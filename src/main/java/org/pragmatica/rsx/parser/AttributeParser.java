package org.pragmatica.rsx.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.rsx.error.Diagnostic;
import org.pragmatica.rsx.error.DiagnosticKind;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.tree.Attribute;
import org.pragmatica.rsx.tree.AttributeValue;
import org.pragmatica.rsx.tree.NodeName;
import org.pragmatica.rsx.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Second phase of open tag parsing: turns the token run collected before {@code >} into attributes.
 */
final class AttributeParser {
    private static final Logger logger = LogManager.getLogger(AttributeParser.class);

    private final ParsingContext ctx;
    private final NodeNameParser names;
    private final BlockParser blocks;

    AttributeParser(ParsingContext ctx, NodeNameParser names, BlockParser blocks) {
        this.ctx = ctx;
        this.names = names;
        this.blocks = blocks;
    }

    /**
     * @param endSpan span of the tag end, reported when a value is cut short
     */
    List<Attribute> parse(List<TokenTree> tokens, SourceSpan endSpan) {
        var input = TwoPhaseTokenizer.reparse(tokens, endSpan);
        var attributes = new ArrayList<Attribute>();
        while (!input.isEmpty() && !ctx.isAborted()) {
            int before = input.position();
            attribute(input).ifPresent(attributes::add);
            if (input.position() == before) {
                var skipped = input.skip();
                logger.trace("No progress in attributes, skipped {}", skipped);
                skipped.ifPresent(token -> ctx.record(DiagnosticKind.UNEXPECTED_TOKEN,
                                                      "unexpected token `" + token.text() + "` in open tag",
                                                      token.span()));
            }
        }
        return attributes;
    }

    private Optional<Attribute> attribute(TokenInput input) {
        if (input.peekBrace()) {
            return blocks.block(input)
                         .map(Attribute.Dynamic::new);
        }
        int before = input.position();
        var key = ctx.attempt(DiagnosticKind.INVALID_NODE_NAME, () -> names.parse(input));
        if (key.isEmpty()) {
            if (input.position() == before) {
                input.skip();
            }
            return Optional.empty();
        }
        return Optional.of(keyed(input, key.get()));
    }

    private Attribute keyed(TokenInput input, NodeName key) {
        var equals = input.parseOptionalPunct('=');
        if (equals.isEmpty()) {
            return new Attribute.Keyed(key, Optional.empty(), key.span());
        }
        var span = key.span()
                      .merge(equals.get()
                                   .span());
        if (input.isEmpty()) {
            ctx.record(Diagnostic.error(DiagnosticKind.MISSING_ATTRIBUTE_VALUE, "missing attribute value", span)
                                 .withLabel("expected a value after `=`"));
            return new Attribute.Keyed(key, Optional.empty(), span);
        }
        var value = input.peekBrace()
                    ? blocks.block(input)
                            .<AttributeValue>map(AttributeValue.Braced::new)
                    : expression(input);
        return new Attribute.Keyed(key,
                                   value,
                                   value.map(v -> span.merge(v.span()))
                                        .orElse(span));
    }

    private Optional<AttributeValue> expression(TokenInput input) {
        var fork = input.fork();
        var expression = ctx.attempt(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION,
                                     () -> ctx.config()
                                              .hostParser()
                                              .parseExpression(fork));
        if (expression.isPresent()) {
            input.advanceTo(fork);
        }else {
            skipRejectedValue(input);
        }
        return expression.<AttributeValue>map(AttributeValue.Expression::new);
    }

    /**
     * Skip the rest of a value the host rejected, up to the next token that can start an attribute.
     */
    private static void skipRejectedValue(TokenInput input) {
        int skipped = 0;
        do {
            input.skip();
            skipped++ ;
        } while (!input.isEmpty() && !input.peekIdent() && !input.peekBrace());
        logger.trace("Skipped {} tokens of a rejected attribute value", skipped);
    }
}
