package org.pragmatica.rsx.host;

import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.token.Tokens;
import org.pragmatica.rsx.tree.SourceSpan;

import java.util.List;

/**
 * Reference host parser for a small, Rust-flavoured expression language.
 * <p>
 * Accepted forms: literals, {@code a::b} paths, macro calls {@code m!(..)}, calls, indexing, member access,
 * unary and binary operators, {@code ?}, tuples and arrays, {@code if}/{@code else}, and blocks of
 * {@code ;}-separated statements including {@code let} bindings. It validates structure only; the handle
 * keeps the tokens.
 * <p>
 * Groups nested deeper than the configured limit are rejected with a {@link SyntaxException}, so the parser never
 * recurses more than that many levels.
 */
public final class SimpleExpressionParser implements HostExpressionParser {
    public static final int DEFAULT_MAX_DEPTH = 128;
    public static final SimpleExpressionParser INSTANCE = new SimpleExpressionParser(DEFAULT_MAX_DEPTH);

    private static final String UNARY_OPERATORS = "-!&*";
    private static final String BINARY_OPERATORS = "+-*/%^<>=|&";
    private static final int MAX_OPERATOR_LENGTH = 3;

    /**
     * Outermost form of a parsed expression.
     */
    public enum Shape {
        LITERAL,
        PATH,
        MACRO,
        CALL,
        INDEX,
        MEMBER,
        TRY,
        UNARY,
        BINARY,
        GROUP,
        CONDITIONAL,
        BLOCK
    }

    public record SimpleExpression(Shape shape, List<TokenTree> tokens, SourceSpan span) implements HostExpression {
        public SimpleExpression {
            tokens = List.copyOf(tokens);
        }

        @Override
        public String toString() {
            return Tokens.toCanonicalString(tokens);
        }
    }

    private final int maxDepth;

    private SimpleExpressionParser(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Parser accepting at most {@code maxDepth} levels of nested groups.
     */
    public static SimpleExpressionParser withMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        return new SimpleExpressionParser(maxDepth);
    }

    public int maxDepth() {
        return maxDepth;
    }

    @Override
    public HostExpression parseExpression(TokenInput input) throws SyntaxException {
        var start = input.cursor();
        var shape = expression(input, 0);
        var tokens = start.until(input.cursor());
        return new SimpleExpression(shape, tokens, Tokens.spanOf(tokens));
    }

    @Override
    public HostExpression parseBlock(TokenInput content, SourceSpan braces) throws SyntaxException {
        var start = content.cursor();
        statements(content, 1);
        return new SimpleExpression(Shape.BLOCK, start.until(content.cursor()), braces);
    }

    private void statements(TokenInput input, int depth) throws SyntaxException {
        while (!input.isEmpty()) {
            if (input.parseOptionalPunct(';')
                     .isPresent()) {
                continue;
            }
            if (isKeyword(input, "let")) {
                letBinding(input, depth);
            }else {
                var shape = expression(input, depth);
                if (!input.isEmpty() && shape != Shape.BLOCK && shape != Shape.CONDITIONAL) {
                    input.parsePunct(';');
                }
            }
        }
    }

    private void letBinding(TokenInput input, int depth) throws SyntaxException {
        // `let`
        input.next();
        if (isKeyword(input, "mut")) {
            input.next();
        }
        input.parseIdent();
        if (input.parseOptionalPunct(':')
                 .isPresent()) {
            path(input);
        }
        if (input.parseOptionalPunct('=')
                 .isPresent()) {
            expression(input, depth);
        }
        if (!input.isEmpty()) {
            input.parsePunct(';');
        }
    }

    private Shape expression(TokenInput input, int depth) throws SyntaxException {
        var shape = unary(input, depth);
        while (binaryOperator(input)) {
            unary(input, depth);
            shape = Shape.BINARY;
        }
        return shape;
    }

    private boolean binaryOperator(TokenInput input) {
        var isRange = input.peekPunct('.') && input.peekPunct(1, '.');
        if (!isRange && !isOperatorPunct(input, BINARY_OPERATORS)) {
            return false;
        }
        int consumed = 0;
        while (consumed < MAX_OPERATOR_LENGTH && (isOperatorPunct(input, BINARY_OPERATORS) || input.peekPunct('.'))) {
            var punct = (TokenTree.Punct) input.peek()
                                               .orElseThrow();
            input.parseOptionalPunct(punct.ch());
            consumed++ ;
            if (!punct.isJoint()) {
                break;
            }
        }
        return true;
    }

    private Shape unary(TokenInput input, int depth) throws SyntaxException {
        boolean prefixed = false;
        while (isOperatorPunct(input, UNARY_OPERATORS)) {
            input.next();
            prefixed = true;
        }
        var shape = postfix(input, depth);
        return prefixed
               ? Shape.UNARY
               : shape;
    }

    private Shape postfix(TokenInput input, int depth) throws SyntaxException {
        var shape = primary(input, depth);
        while (true) {
            if (input.peekPunct('.') && !input.peekPunct(1, '.')) {
                input.next();
                var member = input.peek();
                if (member.isEmpty() || !(member.get() instanceof TokenTree.Ident
                                          || member.get() instanceof TokenTree.Literal literal
                                             && literal.kind() == TokenTree.LiteralKind.NUMBER)) {
                    throw input.error("expected identifier or number after `.`");
                }
                input.next();
                shape = Shape.MEMBER;
            }else if (peekGroup(input, TokenTree.Delimiter.PAREN)) {
                var group = (TokenTree.Group) input.next();
                commaSeparated(TokenInput.inside(group), nested(group, depth));
                shape = Shape.CALL;
            }else if (peekGroup(input, TokenTree.Delimiter.BRACKET)) {
                var group = (TokenTree.Group) input.next();
                var index = TokenInput.inside(group);
                expression(index, nested(group, depth));
                index.expectEnd();
                shape = Shape.INDEX;
            }else if (input.peekPunct('?')) {
                input.next();
                shape = Shape.TRY;
            }else {
                return shape;
            }
        }
    }

    private Shape primary(TokenInput input, int depth) throws SyntaxException {
        var next = input.peek();
        if (next.isEmpty()) {
            throw input.error("expected expression, found end of input");
        }
        var token = next.get();
        if (token instanceof TokenTree.Literal) {
            input.next();
            return Shape.LITERAL;
        }
        if (isKeyword(input, "if")) {
            conditional(input, depth);
            return Shape.CONDITIONAL;
        }
        if (token instanceof TokenTree.Ident) {
            path(input);
            if (input.peekPunct('!') && input.peek(1)
                                             .filter(TokenTree.Group.class::isInstance)
                                             .isPresent()) {
                input.next();
                input.next();
                return Shape.MACRO;
            }
            return Shape.PATH;
        }
        if (token instanceof TokenTree.Group group) {
            input.next();
            var inner = TokenInput.inside(group);
            if (group.isBrace()) {
                statements(inner, nested(group, depth));
                return Shape.BLOCK;
            }
            commaSeparated(inner, nested(group, depth));
            return Shape.GROUP;
        }
        throw input.error("expected expression, found `" + token.text() + "`");
    }

    private void conditional(TokenInput input, int depth) throws SyntaxException {
        while (true) {
            // `if`
            input.next();
            expression(input, depth);
            body(input, depth);
            if (!isKeyword(input, "else")) {
                return;
            }
            input.next();
            if (!isKeyword(input, "if")) {
                body(input, depth);
                return;
            }
        }
    }

    private void body(TokenInput input, int depth) throws SyntaxException {
        var braces = input.parseBrace();
        statements(TokenInput.inside(braces), nested(braces, depth));
    }

    private int nested(TokenTree.Group group, int depth) throws SyntaxException {
        if (depth >= maxDepth) {
            throw new SyntaxException("expression nested too deeply, the limit is " + maxDepth + " levels",
                                      group.openSpan());
        }
        return depth + 1;
    }

    private void path(TokenInput input) throws SyntaxException {
        input.parseIdent();
        while (input.peekPathSeparator(0)) {
            input.next();
            input.next();
            input.parseIdent();
        }
    }

    private void commaSeparated(TokenInput input, int depth) throws SyntaxException {
        while (!input.isEmpty()) {
            expression(input, depth);
            if (!input.isEmpty()) {
                input.parsePunct(',');
            }
        }
    }

    private static boolean isKeyword(TokenInput input, String keyword) {
        return input.peek()
                    .filter(t -> t instanceof TokenTree.Ident ident && ident.name()
                                                                             .equals(keyword))
                    .isPresent();
    }

    private static boolean isOperatorPunct(TokenInput input, String operators) {
        return input.peek()
                    .filter(t -> t instanceof TokenTree.Punct punct && operators.indexOf(punct.ch()) >= 0)
                    .isPresent();
    }

    private static boolean peekGroup(TokenInput input, TokenTree.Delimiter delimiter) {
        return input.peek()
                    .filter(t -> t instanceof TokenTree.Group group && group.delimiter() == delimiter)
                    .isPresent();
    }
}
