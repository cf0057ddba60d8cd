package org.pragmatica.rsx.tree;

import org.pragmatica.rsx.host.HostExpression;
import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.token.Tokens;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Markup node. Containers own their children exclusively; nodes never share subtrees.
 */
public sealed interface Node {
    SourceSpan span();

    NodeKind kind();

    /**
     * Direct children; empty for every variant except elements and fragments.
     */
    default List<Node> children() {
        return List.of();
    }

    /**
     * Pre-order listing of this node and its descendants. Containers appear with their children moved out.
     */
    default List<Node> flatten() {
        var result = new ArrayList<Node>();
        flattenInto(this, result);
        return result;
    }

    /**
     * Pre-order flattening of a node sequence.
     */
    static List<Node> flatten(List<Node> nodes) {
        var result = new ArrayList<Node>();
        for (var node : nodes) {
            flattenInto(node, result);
        }
        return result;
    }

    private static void flattenInto(Node node, List<Node> result) {
        if (node instanceof Element element) {
            result.add(element.withChildren(List.of()));
            element.children()
                   .forEach(child -> flattenInto(child, result));
        }else if (node instanceof Fragment fragment) {
            result.add(fragment.withChildren(List.of()));
            fragment.children()
                    .forEach(child -> flattenInto(child, result));
        }else {
            result.add(node);
        }
    }

    /**
     * Element with its open tag, children and the close tag that ended it, if any.
     * The close tag name may differ from the open tag name when recovery attached a mismatched one.
     */
    record Element(OpenTag openTag, List<Node> children, Optional<CloseTag> closeTag, SourceSpan span) implements Node {
        public Element {
            children = List.copyOf(children);
        }

        public NodeName name() {
            return openTag.name();
        }

        public List<Attribute> attributes() {
            return openTag.attributes();
        }

        public Element withChildren(List<Node> children) {
            return new Element(openTag, children, closeTag, span);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ELEMENT;
        }
    }

    record Fragment(List<Node> children, Optional<FragmentClose> close, SourceSpan span) implements Node {
        public Fragment {
            children = List.copyOf(children);
        }

        public Fragment withChildren(List<Node> children) {
            return new Fragment(children, close, span);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FRAGMENT;
        }
    }

    /**
     * Quoted text.
     */
    record Text(TokenTree.Literal literal) implements Node {
        public String value() {
            return literal.value();
        }

        @Override
        public SourceSpan span() {
            return literal.span();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TEXT;
        }
    }

    /**
     * Unquoted run of tokens.
     *
     * @param boundaries spans of the structures right before and after the run, assigned by the parent container
     */
    record RawText(List<TokenTree> tokens, Optional<Boundaries> boundaries) implements Node {
        public RawText {
            tokens = List.copyOf(tokens);
        }

        public static RawText of(List<TokenTree> tokens) {
            return new RawText(tokens, Optional.empty());
        }

        public record Boundaries(SourceSpan before, SourceSpan after) {}

        public RawText withBoundaries(SourceSpan before, SourceSpan after) {
            return new RawText(tokens, Optional.of(new Boundaries(before, after)));
        }

        public boolean isEmpty() {
            return tokens.isEmpty();
        }

        /**
         * Whitespace-normalized rendering of the tokens.
         */
        public String toTokenString() {
            return Tokens.toCanonicalString(tokens);
        }

        @Override
        public SourceSpan span() {
            return Tokens.spanOf(tokens);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RAW_TEXT;
        }
    }

    /**
     * {@code <!-- "text" -->}
     */
    record Comment(TokenTree.Literal literal, SourceSpan span) implements Node {
        public String value() {
            return literal.value();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMMENT;
        }
    }

    /**
     * {@code <!doctype html>}; the value holds everything between the keyword and {@code >}.
     */
    record Doctype(RawText value, SourceSpan span) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.DOCTYPE;
        }
    }

    record Block(NodeBlock block) implements Node {
        public Optional<HostExpression> tryExpression() {
            return block.tryExpression();
        }

        @Override
        public SourceSpan span() {
            return block.span();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BLOCK;
        }
    }
}
