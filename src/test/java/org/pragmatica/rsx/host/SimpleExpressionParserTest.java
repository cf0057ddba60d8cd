package org.pragmatica.rsx.host;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.token.TokenLexer;
import org.pragmatica.rsx.token.TokenTree;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SimpleExpressionParserTest {

    private final SimpleExpressionParser parser = SimpleExpressionParser.INSTANCE;

    @ParameterizedTest
    @ValueSource(strings = {
        "{x}",
        "{a::b(1, \"s\")}",
        "{items.iter().map(f)?}",
        "{let y = x + 1; y * 2}",
        "{let mut n: u32 = 0;}",
        "{if a { b } else if c { d } else { e }}",
        "{format!(\"{}\", x)}",
        "{-x}",
        "{a[0].1}",
        "{0..10}",
        "{a == b && !c}",
        "{(1, 2)}",
        "{}"
    })
    void parseBlock_validCode_succeeds(String source) {
        assertDoesNotThrow(() -> parseBlock(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {"{x.}", "{%}", "{a b}", "{let}", "{f(,)}", "{a[1 2]}"})
    void parseBlock_invalidCode_fails(String source) {
        assertThrows(SyntaxException.class, () -> parseBlock(source));
    }

    @Test
    void parseBlock_memberWithoutName_explainsError() {
        var error = assertThrows(SyntaxException.class, () -> parseBlock("{x.}"));

        assertEquals("expected identifier or number after `.`", error.getMessage());
    }

    @Test
    void parseBlock_keepsContentTokensAndBraceSpan() throws SyntaxException {
        var group = group("{a + b}");

        var expression = parser.parseBlock(TokenInput.inside(group), group.span());

        assertEquals(3, expression.tokens().size());
        assertEquals(group.span(), expression.span());
        var simple = assertInstanceOf(SimpleExpressionParser.SimpleExpression.class, expression);
        assertEquals(SimpleExpressionParser.Shape.BLOCK, simple.shape());
    }

    @Test
    void parseExpression_stopsAtFirstTokenOutsideExpression() throws SyntaxException {
        var input = TokenInput.of(TokenLexer.tokenize("\"moo\" baz").tokens());

        var expression = parser.parseExpression(input);

        assertEquals(1, expression.tokens().size());
        assertEquals(Optional.of("moo"), expression.stringValue());
        assertEquals("baz", input.parseIdent().name());
    }

    @Test
    void parseExpression_reportsShape() throws SyntaxException {
        assertEquals(SimpleExpressionParser.Shape.CALL, shapeOf("f(x)"));
        assertEquals(SimpleExpressionParser.Shape.MEMBER, shapeOf("a.b"));
        assertEquals(SimpleExpressionParser.Shape.BINARY, shapeOf("a + b"));
        assertEquals(SimpleExpressionParser.Shape.MACRO, shapeOf("vec![1]"));
        assertEquals(SimpleExpressionParser.Shape.PATH, shapeOf("std::io"));
    }

    @Test
    void parseBlock_groupsBeyondDepthLimit_fail() throws SyntaxException {
        var limited = SimpleExpressionParser.withMaxDepth(3);
        var shallow = group("{((x))}");
        var deep = group("{(((x)))}");

        assertDoesNotThrow(() -> limited.parseBlock(TokenInput.inside(shallow), shallow.span()));
        var error = assertThrows(SyntaxException.class,
                                 () -> limited.parseBlock(TokenInput.inside(deep), deep.span()));
        assertEquals("expression nested too deeply, the limit is 3 levels", error.getMessage());
        assertEquals(1, error.span().start().line());
        assertEquals(4, error.span().start().column());
    }

    @Test
    void parseExpression_longPrefixChain_isUnary() throws SyntaxException {
        assertEquals(SimpleExpressionParser.Shape.UNARY, shapeOf("- ".repeat(50_000) + "x"));
        assertEquals(SimpleExpressionParser.Shape.CONDITIONAL, shapeOf("if a { b }" + " else if c { d }".repeat(10_000)));
    }

    @Test
    void withMaxDepth_rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> SimpleExpressionParser.withMaxDepth(0));
        assertEquals(SimpleExpressionParser.DEFAULT_MAX_DEPTH, SimpleExpressionParser.INSTANCE.maxDepth());
    }

    @Test
    void stringValue_presentOnlyForSingleStringLiteral() throws SyntaxException {
        var text = group("{\"hi\"}");
        var other = group("{x}");

        assertEquals(Optional.of("hi"), parser.parseBlock(TokenInput.inside(text), text.span()).stringValue());
        assertTrue(parser.parseBlock(TokenInput.inside(other), other.span()).stringValue().isEmpty());
    }

    private HostExpression parseBlock(String source) throws SyntaxException {
        var group = group(source);
        return parser.parseBlock(TokenInput.inside(group), group.span());
    }

    private SimpleExpressionParser.Shape shapeOf(String source) throws SyntaxException {
        var expression = parser.parseExpression(TokenInput.of(TokenLexer.tokenize(source).tokens()));
        return ((SimpleExpressionParser.SimpleExpression) expression).shape();
    }

    private static TokenTree.Group group(String source) throws SyntaxException {
        return (TokenTree.Group) TokenLexer.tokenize(source).tokens().get(0);
    }
}
