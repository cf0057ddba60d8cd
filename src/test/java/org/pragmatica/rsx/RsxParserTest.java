package org.pragmatica.rsx;

import org.junit.jupiter.api.Test;
import org.pragmatica.rsx.error.DiagnosticKind;
import org.pragmatica.rsx.error.RsxParseException;
import org.pragmatica.rsx.parser.ParseOutcome;
import org.pragmatica.rsx.parser.RawTextReconstructor;
import org.pragmatica.rsx.token.TokenLexer;
import org.pragmatica.rsx.token.TokenTree;
import org.pragmatica.rsx.tree.Attribute;
import org.pragmatica.rsx.tree.AttributeValue;
import org.pragmatica.rsx.tree.Node;
import org.pragmatica.rsx.tree.NodeKind;
import org.pragmatica.rsx.tree.NodeName;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RsxParserTest {

    // === Elements ===

    @Test
    void parse_elementWithStringAttributes_succeeds() throws RsxParseException {
        var nodes = RsxParser.parse("<foo bar=\"moo\" baz=\"42\"></foo>");

        assertEquals(1, nodes.size());
        var element = assertInstanceOf(Node.Element.class, nodes.get(0));
        assertEquals("foo", element.name().toString());
        assertTrue(element.children().isEmpty());
        assertTrue(element.closeTag().isPresent());

        var attributes = element.attributes();
        assertEquals(2, attributes.size());
        var bar = assertInstanceOf(Attribute.Keyed.class, attributes.get(0));
        assertEquals("bar", bar.key().toString());
        assertEquals(Optional.of("moo"), bar.valueAsString());
        var baz = assertInstanceOf(Attribute.Keyed.class, attributes.get(1));
        assertEquals("baz", baz.key().toString());
        assertEquals(Optional.of("42"), baz.valueAsString());
    }

    @Test
    void parse_nestedElements_keepsVerbatimNames() throws RsxParseException {
        var nodes = RsxParser.parse("<some::path><data-foo/><on:click/><a-b:c></a-b:c></some::path>");

        var root = assertInstanceOf(Node.Element.class, nodes.get(0));
        assertInstanceOf(NodeName.SimplePath.class, root.name());
        assertEquals("some::path", root.name().toString());

        var names = root.children()
                        .stream()
                        .map(child -> ((Node.Element) child).name())
                        .toList();
        assertEquals(3, names.size());
        assertEquals("data-foo", names.get(0).toString());
        assertEquals("on:click", names.get(1).toString());
        assertEquals("a-b:c", names.get(2).toString());
        names.forEach(name -> assertInstanceOf(NodeName.Punctuated.class, name));
    }

    @Test
    void parse_selfClosingElement_hasNoChildrenAndNoCloseTag() throws RsxParseException {
        var element = (Node.Element) RsxParser.parse("<div/>").get(0);

        assertTrue(element.openTag().selfClosing());
        assertTrue(element.children().isEmpty());
        assertTrue(element.closeTag().isEmpty());
    }

    @Test
    void parse_dynamicName_keepsBlock() throws RsxParseException {
        var element = (Node.Element) RsxParser.parse("<{tag}></{tag}>").get(0);

        var name = assertInstanceOf(NodeName.Dynamic.class, element.name());
        assertTrue(name.block().tryExpression().isPresent());
        assertEquals("{ tag }", name.toString());
    }

    @Test
    void parse_attributeForms_recognizesEach() throws RsxParseException {
        var element = (Node.Element) RsxParser.parse("<button on:click={handle} disabled data-id=42 {extra}/>").get(0);
        var attributes = element.attributes();

        assertEquals(4, attributes.size());

        var onClick = assertInstanceOf(Attribute.Keyed.class, attributes.get(0));
        assertEquals("on:click", onClick.key().toString());
        assertInstanceOf(AttributeValue.Braced.class, onClick.value().orElseThrow());

        var disabled = assertInstanceOf(Attribute.Keyed.class, attributes.get(1));
        assertEquals("disabled", disabled.key().toString());
        assertTrue(disabled.value().isEmpty());

        var dataId = assertInstanceOf(Attribute.Keyed.class, attributes.get(2));
        assertEquals("data-id", dataId.key().toString());
        assertInstanceOf(AttributeValue.Expression.class, dataId.value().orElseThrow());
        assertTrue(dataId.valueAsString().isEmpty());

        assertInstanceOf(Attribute.Dynamic.class, attributes.get(3));
    }

    @Test
    void parse_blockAttributeValueWithString_exposesString() throws RsxParseException {
        var element = (Node.Element) RsxParser.parse("<a href={\"/home\"}/>").get(0);
        var href = (Attribute.Keyed) element.attributes().get(0);

        assertEquals(Optional.of("/home"), href.valueAsString());
    }

    @Test
    void parse_attributeValueExpression_stopsAtTagEnd() throws RsxParseException {
        var element = (Node.Element) RsxParser.parse("<input value=a.b(1) checked/>").get(0);

        assertEquals(2, element.attributes().size());
        var value = (Attribute.Keyed) element.attributes().get(0);
        var expression = (AttributeValue.Expression) value.value().orElseThrow();
        assertEquals(4, expression.expression().tokens().size());
    }

    // === Children ===

    @Test
    void parse_childrenOfEveryKind_succeeds() throws RsxParseException {
        var nodes = RsxParser.parse("<div>\"text\" {value} raw words <!-- \"note\" --> <span/></div>");
        var children = nodes.get(0).children();

        assertEquals(List.of(NodeKind.TEXT, NodeKind.BLOCK, NodeKind.RAW_TEXT, NodeKind.COMMENT, NodeKind.ELEMENT),
                     children.stream().map(Node::kind).toList());
        assertEquals("text", ((Node.Text) children.get(0)).value());
        assertEquals("raw words", ((Node.RawText) children.get(2)).toTokenString());
        assertEquals("note", ((Node.Comment) children.get(3)).value());
    }

    @Test
    void parse_fragment_collectsChildren() throws RsxParseException {
        var fragment = assertInstanceOf(Node.Fragment.class, RsxParser.parse("<><div/>\"x\"</>").get(0));

        assertEquals(2, fragment.children().size());
        assertTrue(fragment.close().isPresent());
    }

    @Test
    void parse_doctype_keepsValue() throws RsxParseException {
        var nodes = RsxParser.parse("<!DOCTYPE html><html></html>");

        assertEquals(2, nodes.size());
        var doctype = assertInstanceOf(Node.Doctype.class, nodes.get(0));
        assertEquals("html", doctype.value().toTokenString());
    }

    @Test
    void parse_emptyInput_returnsNoNodes() throws RsxParseException {
        assertTrue(RsxParser.parse("").isEmpty());
        assertInstanceOf(ParseOutcome.Ok.class, RsxParser.parseRecoverable(""));
    }

    // === Configured element names ===

    @Test
    void parse_selfClosingName_neverHasChildren() throws RsxParseException {
        var parser = RsxParser.builder()
                              .selfClosing("br", "img")
                              .build();

        var nodes = parser.parseStrict("<div><br>\"line\"<img src=\"a.png\"/></div>");
        var children = nodes.get(0).children();

        assertEquals(3, children.size());
        var br = (Node.Element) children.get(0);
        assertEquals("br", br.name().toString());
        assertTrue(br.children().isEmpty());
        assertInstanceOf(Node.Text.class, children.get(1));
    }

    @Test
    void parse_rawTextName_capturesContentVerbatim() throws RsxParseException {
        var source = "<script>if (a < b) { run(); } </div> \"s\"</script>";
        var stream = assertDoesNotThrow(() -> TokenLexer.tokenize(source));
        var parser = RsxParser.htmlBuilder().build();

        var script = (Node.Element) parser.parseStrict(stream).get(0);

        assertEquals(1, script.children().size());
        var raw = assertInstanceOf(Node.RawText.class, script.children().get(0));
        assertEquals("if (a < b) { run(); } </div> \"s\"", RawTextReconstructor.of(stream).toStringBest(raw));
    }

    @Test
    void parse_emptyRawTextElement_hasNoChildren() throws RsxParseException {
        var style = (Node.Element) RsxParser.parse("<style></style>", RsxParser.htmlBuilder().config()).get(0);

        assertTrue(style.children().isEmpty());
        assertTrue(style.closeTag().isPresent());
    }

    // === Tree shape options ===

    @Test
    void parse_flatTree_yieldsNodesInPreOrder() throws RsxParseException {
        var parser = RsxParser.builder()
                              .flatTree(true)
                              .build();

        var nodes = parser.parseStrict("<div><div><div>{x}</div><div>\"w\"</div></div></div><div/>");

        assertEquals(7, nodes.size());
        assertEquals(List.of(NodeKind.ELEMENT, NodeKind.ELEMENT, NodeKind.ELEMENT, NodeKind.BLOCK,
                             NodeKind.ELEMENT, NodeKind.TEXT, NodeKind.ELEMENT),
                     nodes.stream().map(Node::kind).toList());
        nodes.forEach(node -> assertTrue(node.children().isEmpty()));
    }

    @Test
    void parse_topLevelCount_acceptsOnlyExactCount() {
        var parser = RsxParser.builder()
                              .topLevelCount(2)
                              .build();

        var three = parser.parseRecoverable("<div/><div/><div/>");
        assertInstanceOf(ParseOutcome.Partial.class, three);
        assertEquals(3, three.value().orElseThrow().size());
        assertEquals(DiagnosticKind.TOP_LEVEL_CARDINALITY_VIOLATION, three.diagnostics().get(0).kind());

        var one = assertThrows(RsxParseException.class, () -> parser.parseStrict("<div/>"));
        assertEquals(DiagnosticKind.TOP_LEVEL_CARDINALITY_VIOLATION, one.kind());

        assertDoesNotThrow(() -> parser.parseStrict("<div/><div/>"));
    }

    @Test
    void parse_topLevelCount_isCheckedBeforeFlattening() throws RsxParseException {
        var parser = RsxParser.builder()
                              .topLevelCount(2)
                              .flatTree(true)
                              .build();

        assertEquals(3, parser.parseStrict("<div><div/></div><div/>").size());
    }

    @Test
    void parse_topLevelKind_reportsEveryOffendingNode() {
        var parser = RsxParser.builder()
                              .topLevelKind(NodeKind.ELEMENT)
                              .build();

        var outcome = parser.parseRecoverable("<div/>\"text\"{block}");

        assertEquals(3, outcome.value().orElseThrow().size());
        assertEquals(2, outcome.diagnostics().size());
        outcome.diagnostics()
               .forEach(d -> assertEquals(DiagnosticKind.TOP_LEVEL_KIND_VIOLATION, d.kind()));
    }

    // === Block transform ===

    @Test
    void parse_blockTransform_replacesContent() throws RsxParseException {
        var parser = RsxParser.builder()
                              .blockTransform(content -> {
                                  if (!content.peekPunct('%')) {
                                      return Optional.empty();
                                  }
                                  content.parsePunct('%');
                                  return Optional.of(List.of(TokenTree.Literal.string("percent")));
                              })
                              .build();

        var children = parser.parseStrict("<div>{%}{x}</div>").get(0).children();

        var percent = (Node.Block) children.get(0);
        assertEquals(Optional.of("percent"), percent.tryExpression().flatMap(e -> e.stringValue()));
        var untouched = (Node.Block) children.get(1);
        assertEquals("x", untouched.tryExpression().orElseThrow().tokens().get(0).text());
    }

    @Test
    void parse_blockTransformReturningEmpty_parsesOriginalContentFromStart() throws RsxParseException {
        var parser = RsxParser.builder()
                              .blockTransform(content -> {
                                  content.next();
                                  return Optional.empty();
                              })
                              .build();

        var block = (Node.Block) parser.parseStrict("<div>{a + b}</div>").get(0).children().get(0);

        assertEquals(3, block.tryExpression().orElseThrow().tokens().size());
    }

    // === Strict mode ===

    @Test
    void parseStrict_mismatchedCloseTag_fails() {
        var error = assertThrows(RsxParseException.class,
                                 () -> RsxParser.parse("<div><open></close><foo></foo></div>"));

        assertEquals(DiagnosticKind.MISMATCHED_CLOSE_TAG, error.kind());
        assertTrue(error.getMessage().contains("wrong close tag found"));
    }

    @Test
    void parseStrict_lexerError_isReportedAsParseException() {
        var error = assertThrows(RsxParseException.class, () -> RsxParser.parse("<div>{</div>"));

        assertTrue(error.getMessage().contains("unclosed delimiter"));
    }

    @Test
    void parseRecoverable_strictModeConfig_keepsOnlyFirstDiagnostic() {
        var parser = RsxParser.builder()
                              .strict(true)
                              .recoverInvalidBlocks(true)
                              .build();

        var outcome = parser.parseRecoverable("<div hello={world.} /><a></b><c>");

        var failed = assertInstanceOf(ParseOutcome.Failed.class, outcome);
        assertEquals(1, failed.diagnostics().size());
        assertEquals(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION, outcome.diagnostics().get(0).kind());
    }

    // === Nesting ===

    @Test
    void parse_nestingBeyondLimit_isReported() {
        var parser = RsxParser.builder()
                              .maxNestingDepth(3)
                              .build();

        assertDoesNotThrow(() -> parser.parseStrict("<a><b><c></c></b></a>"));

        var outcome = parser.parseRecoverable("<a><b><c><d></d></c></b></a>");
        assertEquals(DiagnosticKind.NESTING_TOO_DEEP, outcome.diagnostics().get(0).kind());
        assertEquals(1, outcome.diagnostics().size());
    }

    @Test
    void parse_deeplyNestedInput_doesNotOverflowStack() {
        var source = "<a>".repeat(20_000);

        var outcome = RsxParser.parseRecoverable(source);

        assertEquals(DiagnosticKind.NESTING_TOO_DEEP, outcome.diagnostics().get(0).kind());
        assertEquals(1, outcome.value().orElseThrow().size());
    }

    @Test
    void parse_deeplyNestedHostBlock_isReportedAsInvalidBlock() {
        var source = "<div>{" + "(".repeat(20_000) + "x" + ")".repeat(20_000) + "}</div>";

        var outcome = assertDoesNotThrow(() -> RsxParser.parseRecoverable(source));

        assertEquals(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION, outcome.diagnostics().get(0).kind());
        assertTrue(outcome.diagnostics().get(0).message().startsWith("expression nested too deeply"));
        assertEquals(1, outcome.value().orElseThrow().size());
    }

    @Test
    void parse_longPrefixChainInAttribute_doesNotOverflowStack() {
        var source = "<div a=" + "- ".repeat(20_000) + "x />";

        var outcome = assertDoesNotThrow(() -> RsxParser.parseRecoverable(source));

        assertInstanceOf(ParseOutcome.Ok.class, outcome);
        var div = (Node.Element) outcome.value().orElseThrow().get(0);
        var attribute = (Attribute.Keyed) div.attributes().get(0);
        assertTrue(attribute.value().isPresent());
    }

    @Test
    void parse_topLevelRawTextBetweenNodes_keepsWhitespace() throws Exception {
        var stream = TokenLexer.tokenize("<b/>  x   y  <i/>");

        var nodes = RsxParser.parseStrict(stream, RsxParser.builder().config());

        var raw = assertInstanceOf(Node.RawText.class, nodes.get(1));
        assertTrue(raw.boundaries().isPresent());
        assertEquals("  x   y  ", RawTextReconstructor.of(stream).toStringBest(raw));
    }

    @Test
    void parse_topLevelRawTextAtEdge_hasNoBoundaries() throws Exception {
        var stream = TokenLexer.tokenize("x  y <i/>");

        var raw = assertInstanceOf(Node.RawText.class, RsxParser.parseStrict(stream, RsxParser.builder().config()).get(0));

        assertTrue(raw.boundaries().isEmpty());
        assertEquals("x  y", RawTextReconstructor.of(stream).toStringBest(raw));
    }
}
