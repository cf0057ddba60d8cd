package org.pragmatica.rsx.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.rsx.error.Diagnostic;
import org.pragmatica.rsx.error.DiagnosticKind;
import org.pragmatica.rsx.token.Lookahead;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.tree.CloseTag;
import org.pragmatica.rsx.tree.FragmentClose;
import org.pragmatica.rsx.tree.Node;
import org.pragmatica.rsx.tree.NodeName;
import org.pragmatica.rsx.tree.OpenTag;
import org.pragmatica.rsx.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive descent over markup constructs. Every construct parser records its own diagnostics and returns
 * empty only when nothing usable could be built.
 */
final class NodeGrammar {
    private static final Logger logger = LogManager.getLogger(NodeGrammar.class);

    private final ParsingContext ctx;
    private final ParserConfig config;
    private final BlockParser blocks;
    private final NodeNameParser names;
    private final AttributeParser attributes;

    NodeGrammar(ParsingContext ctx) {
        this.ctx = ctx;
        this.config = ctx.config();
        this.blocks = new BlockParser(ctx);
        this.names = new NodeNameParser(blocks);
        this.attributes = new AttributeParser(ctx, names, blocks);
    }

    // === Top Level ===

    /**
     * Parse the whole input. Top-level constraints are checked on the node sequence before it is flattened.
     */
    List<Node> topLevel(TokenInput input) {
        var nodes = new ArrayList<Node>();
        while (!input.isEmpty() && !ctx.isAborted()) {
            int before = input.position();
            node(input).ifPresent(nodes::add);
            if (input.position() == before && !forceProgress(input)) {
                break;
            }
        }
        checkTopLevel(nodes, input);
        var bounded = RawTextReconstructor.assignBoundaries(Optional.empty(), nodes, Optional.empty());
        return config.flatTree()
               ? Node.flatten(bounded)
               : bounded;
    }

    private void checkTopLevel(List<Node> nodes, TokenInput input) {
        config.topLevelKind()
              .ifPresent(kind -> nodes.stream()
                                      .filter(node -> node.kind() != kind)
                                      .forEach(node -> ctx.record(Diagnostic.error(DiagnosticKind.TOP_LEVEL_KIND_VIOLATION,
                                                                                   "top level nodes need to be of kind "
                                                                                   + kind.display(),
                                                                                   node.span())
                                                                            .withLabel("found " + node.kind()
                                                                                                      .display()))));
        config.topLevelCount()
              .filter(count -> count != nodes.size())
              .ifPresent(count -> ctx.record(DiagnosticKind.TOP_LEVEL_CARDINALITY_VIOLATION,
                                             "saw " + nodes.size() + " top level nodes but exactly " + count
                                             + " are required",
                                             nodes.isEmpty()
                                             ? input.span()
                                             : nodes.get(0)
                                                    .span()
                                                    .merge(nodes.get(nodes.size() - 1)
                                                                .span())));
    }

    // === Nodes ===

    Optional<Node> node(TokenInput input) {
        return switch (Lookahead.classify(input.cursor())) {
            case DOCTYPE -> doctype(input);
            case COMMENT -> comment(input);
            case FRAGMENT -> fragment(input);
            case ELEMENT -> element(input);
            case CLOSE_TAG, FRAGMENT_CLOSE -> strayCloseTag(input);
            case BLOCK -> blocks.block(input)
                                .<Node>map(Node.Block::new);
            case TEXT -> input.skip()
                              .<Node>map(token -> new Node.Text((TokenTree.Literal) token));
            case RAW_TEXT -> Optional.<Node>of(rawText(input));
            case END -> Optional.empty();
        };
    }

    private List<Node> children(TokenInput input) {
        var children = new ArrayList<Node>();
        while (!input.isEmpty() && !ctx.isAborted() && !Lookahead.isCloseTagStart(input.cursor())) {
            int before = input.position();
            node(input).ifPresent(children::add);
            if (input.position() == before && !forceProgress(input)) {
                break;
            }
        }
        return children;
    }

    /**
     * Skip one token that is not {@code <} so a stuck loop can move on. Returns false when the loop must stop.
     */
    private boolean forceProgress(TokenInput input) {
        if (input.isEmpty() || input.peekPunct('<')) {
            ctx.record(DiagnosticKind.UNEXPECTED_END_OF_INPUT, "parser made no progress", input.span());
            return false;
        }
        var skipped = input.skip();
        logger.trace("No progress at {}, skipped {}", input.span(), skipped);
        skipped.ifPresent(token -> ctx.record(DiagnosticKind.UNEXPECTED_TOKEN,
                                              "unexpected token `" + token.text() + "`",
                                              token.span()));
        return true;
    }

    private Node.RawText rawText(TokenInput input) {
        var start = input.cursor();
        while (!input.isEmpty() && !Lookahead.isNodeBoundary(input.cursor())) {
            input.skip();
        }
        return Node.RawText.of(start.until(input.cursor()));
    }

    // === Elements ===

    private Optional<Node> element(TokenInput input) {
        var openTag = openTag(input);
        if (openTag.isEmpty()) {
            return Optional.empty();
        }
        var tag = openTag.get();
        if (tag.selfClosing() || config.isSelfClosing(tag.name())) {
            return Optional.of(new Node.Element(tag, List.of(), Optional.empty(), tag.span()));
        }
        if (!ctx.enter(tag.span())) {
            return Optional.empty();
        }
        try{
            var content = config.isRawText(tag.name())
                          ? rawTextContent(input, tag.name())
                          : children(input);
            var closeTag = closeTag(input, tag);
            var children = RawTextReconstructor.assignBoundaries(Optional.of(tag.end()),
                                                                 content,
                                                                 closeTag.map(CloseTag::start));
            var span = closeTag.map(close -> tag.span()
                                                .merge(close.span()))
                               .orElseGet(() -> spanWithChildren(tag.span(), children));
            return Optional.of(new Node.Element(tag, children, closeTag, span));
        } finally{
            ctx.exit();
        }
    }

    private Optional<OpenTag> openTag(TokenInput input) {
        var lt = input.skip()
                      .map(TokenTree::span)
                      .orElse(SourceSpan.UNKNOWN);
        var name = ctx.attempt(DiagnosticKind.INVALID_NODE_NAME, () -> names.parse(input));
        if (name.isEmpty()) {
            return Optional.empty();
        }
        var attributeTokens = TwoPhaseTokenizer.collectUntil(input, TwoPhaseTokenizer::isOpenTagEnd);
        if (input.isEmpty()) {
            ctx.record(Diagnostic.error(DiagnosticKind.UNTERMINATED_OPEN_TAG,
                                        "open tag `<" + name.get() + "` has no closing `>`",
                                        lt.merge(name.get()
                                                     .span()))
                                 .withHelp("add `>` or `/>` to end the tag"));
            return Optional.empty();
        }
        boolean selfClosing = input.parseOptionalPunct('/')
                                   .isPresent();
        var end = input.skip()
                       .map(TokenTree::span)
                       .orElse(SourceSpan.UNKNOWN);
        var parsedAttributes = attributes.parse(attributeTokens, end);
        return Optional.of(new OpenTag(name.get(), parsedAttributes, selfClosing, lt.merge(end), end));
    }

    /**
     * Content of a raw text element: everything up to its own close tag, as at most one raw text child.
     */
    private List<Node> rawTextContent(TokenInput input, NodeName name) {
        var tokens = TwoPhaseTokenizer.collectUntil(input, TwoPhaseTokenizer.closeTagOf(name, names));
        return tokens.isEmpty()
               ? List.of()
               : List.of(Node.RawText.of(tokens));
    }

    private Optional<CloseTag> closeTag(TokenInput input, OpenTag tag) {
        if (ctx.isAborted()) {
            return Optional.empty();
        }
        if (!Lookahead.isCloseTagStart(input.cursor())) {
            ctx.record(Diagnostic.error(DiagnosticKind.UNTERMINATED_OPEN_TAG,
                                        "open tag has no corresponding close tag",
                                        tag.span())
                                 .withHelp("add `</" + tag.name() + ">`"));
            return Optional.empty();
        }
        var start = input.span();
        input.skip();
        input.skip();
        if (input.peekPunct('>')) {
            var gt = input.skip();
            ctx.record(Diagnostic.error(DiagnosticKind.MISMATCHED_CLOSE_TAG,
                                        "expected element close tag, found fragment close",
                                        spanTo(start, gt))
                                 .withSecondaryLabel(tag.name()
                                                        .span(),
                                                     "open tag that should be closed"));
            return Optional.empty();
        }
        var name = ctx.attempt(DiagnosticKind.INVALID_NODE_NAME, () -> names.parse(input));
        if (name.isEmpty()) {
            return Optional.empty();
        }
        var gt = ctx.attempt(DiagnosticKind.UNEXPECTED_TOKEN, () -> input.parsePunct('>'));
        if (gt.isEmpty()) {
            return Optional.empty();
        }
        var close = new CloseTag(name.get(), start.merge(gt.get()
                                                           .span()), start);
        if (!name.get()
                 .matches(tag.name())) {
            ctx.record(Diagnostic.error(DiagnosticKind.MISMATCHED_CLOSE_TAG,
                                        "wrong close tag found",
                                        name.get()
                                            .span())
                                 .withLabel("expected `</" + tag.name() + ">`")
                                 .withSecondaryLabel(tag.name()
                                                        .span(),
                                                     "open tag that should be closed; it starts here"));
        }
        return Optional.of(close);
    }

    private Optional<Node> strayCloseTag(TokenInput input) {
        var start = input.span();
        input.skip();
        input.skip();
        ctx.record(Diagnostic.error(DiagnosticKind.UNEXPECTED_CLOSE_TAG,
                                    "close tag has no corresponding open tag",
                                    start)
                             .withHelp("remove the close tag or add a matching open tag"));
        if (!input.peekPunct('>')) {
            ctx.attempt(DiagnosticKind.INVALID_NODE_NAME, () -> names.parse(input));
        }
        input.parseOptionalPunct('>');
        return Optional.empty();
    }

    // === Fragments ===

    private Optional<Node> fragment(TokenInput input) {
        var start = input.span();
        input.skip();
        var open = spanTo(start, input.skip());
        if (!ctx.enter(open)) {
            return Optional.empty();
        }
        try{
            var content = children(input);
            var close = fragmentClose(input, open);
            var children = RawTextReconstructor.assignBoundaries(Optional.of(open.endPoint()),
                                                                 content,
                                                                 close.map(FragmentClose::start));
            var span = close.map(c -> open.merge(c.span()))
                            .orElseGet(() -> spanWithChildren(open, children));
            return Optional.of(new Node.Fragment(children, close, span));
        } finally{
            ctx.exit();
        }
    }

    private Optional<FragmentClose> fragmentClose(TokenInput input, SourceSpan open) {
        if (ctx.isAborted()) {
            return Optional.empty();
        }
        if (!Lookahead.isCloseTagStart(input.cursor())) {
            ctx.record(Diagnostic.error(DiagnosticKind.UNTERMINATED_FRAGMENT,
                                        "fragment has no corresponding close `</>`",
                                        open));
            return Optional.empty();
        }
        var start = input.span();
        input.skip();
        input.skip();
        if (!input.peekPunct('>')) {
            var name = ctx.attempt(DiagnosticKind.INVALID_NODE_NAME, () -> names.parse(input));
            name.ifPresent(found -> ctx.record(Diagnostic.error(DiagnosticKind.MISMATCHED_CLOSE_TAG,
                                                                "expected fragment closing, found element closing tag",
                                                                found.span())
                                                         .withSecondaryLabel(open, "fragment opened here")));
        }
        var gt = ctx.attempt(DiagnosticKind.UNEXPECTED_TOKEN, () -> input.parsePunct('>'));
        return gt.map(token -> new FragmentClose(start.merge(token.span()), start));
    }

    // === Doctype and Comments ===

    /**
     * {@code <!doctype html>}; the keyword is case-insensitive and everything up to {@code >} is the value.
     */
    private Optional<Node> doctype(TokenInput input) {
        var start = input.span();
        input.skip();
        input.skip();
        var keyword = input.skip()
                           .orElseThrow();
        if (!(keyword instanceof TokenTree.Ident ident && ident.name()
                                                                .equalsIgnoreCase("doctype"))) {
            ctx.record(Diagnostic.error(DiagnosticKind.INVALID_DOCTYPE,
                                        "expected `doctype`, found `" + keyword.text() + "`",
                                        keyword.span()));
            TwoPhaseTokenizer.collectUntil(input, fork -> fork.peekPunct('>'));
            input.parseOptionalPunct('>');
            return Optional.empty();
        }
        var tokens = TwoPhaseTokenizer.collectUntil(input, fork -> fork.peekPunct('>'));
        var gt = ctx.attempt(DiagnosticKind.INVALID_DOCTYPE, () -> input.parsePunct('>'));
        if (gt.isEmpty()) {
            return Optional.empty();
        }
        if (tokens.isEmpty()) {
            ctx.record(DiagnosticKind.INVALID_DOCTYPE, "expected document type after `doctype`", gt.get()
                                                                                                   .span());
        }
        var value = Node.RawText.of(tokens)
                                .withBoundaries(keyword.span(), gt.get()
                                                                  .span());
        return Optional.of(new Node.Doctype(value, start.merge(gt.get()
                                                                 .span())));
    }

    /**
     * {@code <!-- "text" -->}
     */
    private Optional<Node> comment(TokenInput input) {
        var start = input.span();
        return ctx.attempt(DiagnosticKind.INVALID_COMMENT, () -> {
            input.parsePunct('<');
            input.parsePunct('!');
            input.parsePunct('-');
            input.parsePunct('-');
            var text = input.parseStringLiteral();
            input.parsePunct('-');
            input.parsePunct('-');
            var gt = input.parsePunct('>');
            return new Node.Comment(text, start.merge(gt.span()));
        });
    }

    // === Spans ===

    private static SourceSpan spanTo(SourceSpan start, Optional<TokenTree> last) {
        return last.map(token -> start.merge(token.span()))
                   .orElse(start);
    }

    private static SourceSpan spanWithChildren(SourceSpan open, List<Node> children) {
        return children.isEmpty()
               ? open
               : open.merge(children.get(children.size() - 1)
                                    .span());
    }
}
