package org.pragmatica.rsx;

import org.junit.jupiter.api.Test;
import org.pragmatica.rsx.error.Diagnostic;
import org.pragmatica.rsx.error.DiagnosticKind;
import org.pragmatica.rsx.parser.ParseOutcome;
import org.pragmatica.rsx.parser.Parser;
import org.pragmatica.rsx.tree.Attribute;
import org.pragmatica.rsx.tree.Node;
import org.pragmatica.rsx.tree.NodeBlock;
import org.pragmatica.rsx.tree.NodeKind;
import org.pragmatica.rsx.tree.NodeName;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Recoverable parsing: diagnostics are collected and a best-effort tree is still returned.
 */
class ErrorRecoveryTest {

    private static final Parser RECOVERING = RsxParser.builder()
                                                      .recoverInvalidBlocks(true)
                                                      .build();

    @Test
    void mismatchedCloseTag_attachesCloseTagAndContinues() {
        var outcome = RsxParser.parseRecoverable("<div><open></close><foo></foo></div>");

        assertThat(outcome).isInstanceOf(ParseOutcome.Partial.class);
        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.MISMATCHED_CLOSE_TAG);

        var nodes = outcome.value().orElseThrow();
        assertThat(nodes).hasSize(1);
        var div = (Node.Element) nodes.get(0);
        assertThat(div.name().toString()).isEqualTo("div");
        assertThat(div.children()).hasSize(2);

        var open = (Node.Element) div.children().get(0);
        assertThat(open.name().toString()).isEqualTo("open");
        assertThat(open.closeTag()).hasValueSatisfying(close -> assertThat(close.name().toString()).isEqualTo("close"));

        var foo = (Node.Element) div.children().get(1);
        assertThat(foo.name().toString()).isEqualTo("foo");
        assertThat(foo.closeTag()).hasValueSatisfying(close -> assertThat(close.name().matches(foo.name())).isTrue());
    }

    @Test
    void mismatchedCloseTag_pointsAtOpenTag() {
        var diagnostic = RsxParser.parseRecoverable("<div><open></close></div>")
                                  .diagnostics()
                                  .get(0);

        assertThat(diagnostic.secondaryLabels()).hasSize(1);
        assertThat(diagnostic.secondaryLabels().get(0).span().start().column()).isEqualTo(7);
    }

    @Test
    void invalidBlock_withRecovery_keepsTokens() {
        var outcome = RECOVERING.parseRecoverable("<div>{x.}</div><p/>");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION);
        var nodes = outcome.value().orElseThrow();
        assertThat(nodes).hasSize(2);

        var block = (Node.Block) nodes.get(0).children().get(0);
        assertThat(block.block()).isInstanceOf(NodeBlock.Invalid.class);
        assertThat(block.tryExpression()).isEmpty();
        assertThat(block.block().text()).isEqualTo("{ x . }");
    }

    @Test
    void invalidBlock_withoutRecovery_abortsParse() {
        var outcome = RsxParser.parseRecoverable("<div>{x.}</div><p/>");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION);
        var nodes = outcome.value().orElseThrow();
        assertThat(nodes).hasSize(1);
        assertThat(nodes.get(0).children()).isEmpty();
    }

    @Test
    void invalidAttributeBlock_withRecovery_keepsDynamicAttribute() {
        var outcome = RECOVERING.parseRecoverable("<foo {x.} />");

        var element = (Node.Element) outcome.value().orElseThrow().get(0);
        assertThat(element.attributes()).hasSize(1);
        var attribute = (Attribute.Dynamic) element.attributes().get(0);
        assertThat(attribute.block()).isInstanceOf(NodeBlock.Invalid.class);
        assertThat(outcome.diagnostics()).hasSize(1);
    }

    @Test
    void invalidDynamicName_withRecovery_keepsElement() {
        var outcome = RECOVERING.parseRecoverable("<{x.}>\"t\"</{x.}>");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION,
                                                          DiagnosticKind.INVALID_EMBEDDED_EXPRESSION);
        var nodes = outcome.value().orElseThrow();
        assertThat(nodes).hasSize(1);
        var element = (Node.Element) nodes.get(0);
        var name = (NodeName.Dynamic) element.name();
        assertThat(name.block()).isInstanceOf(NodeBlock.Invalid.class);
        assertThat(element.children()).extracting(Node::kind)
                                      .containsExactly(NodeKind.TEXT);
        assertThat(element.closeTag()).hasValueSatisfying(close -> assertThat(close.name().matches(name)).isTrue());
    }

    @Test
    void invalidDynamicName_withoutRecovery_abortsParse() {
        var outcome = RsxParser.parseRecoverable("<{x.}>\"t\"</{x.}><p/>");

        assertThat(outcome).isInstanceOf(ParseOutcome.Failed.class);
        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION);
    }

    @Test
    void invalidAttributeExpression_isReportedOnce() {
        var outcome = RsxParser.parseRecoverable("<div a=%% b=\"1\"/>");
        var trailing = RsxParser.parseRecoverable("<div a=x./>");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION);
        assertThat(trailing.diagnostics()).extracting(Diagnostic::kind)
                                          .containsExactly(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION);
        var div = (Node.Element) outcome.value().orElseThrow().get(0);
        assertThat(div.attributes()).hasSize(2);
        var b = (Attribute.Keyed) div.attributes().get(1);
        assertThat(b.key().toString()).isEqualTo("b");
        assertThat(b.valueAsString()).contains("1");
    }

    @Test
    void fragmentClosedByElementCloseTag_isReported() {
        var outcome = RsxParser.parseRecoverable("<>\"a\"</div>");

        assertThat(outcome.diagnostics()).hasSize(1);
        assertThat(outcome.diagnostics().get(0).message()).isEqualTo("expected fragment closing, found element closing tag");
        var fragment = (Node.Fragment) outcome.value().orElseThrow().get(0);
        assertThat(fragment.close()).isPresent();
        assertThat(fragment.children()).hasSize(1);
    }

    @Test
    void unclosedElement_keepsChildren() {
        var outcome = RsxParser.parseRecoverable("<div>\"a\"<span/>");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.UNTERMINATED_OPEN_TAG);
        var div = (Node.Element) outcome.value().orElseThrow().get(0);
        assertThat(div.closeTag()).isEmpty();
        assertThat(div.children()).hasSize(2);
    }

    @Test
    void unterminatedOpenTag_isReported() {
        var outcome = RsxParser.parseRecoverable("<div class=\"x\"");

        assertThat(outcome).isInstanceOf(ParseOutcome.Failed.class);
        assertThat(outcome.diagnostics().get(0).kind()).isEqualTo(DiagnosticKind.UNTERMINATED_OPEN_TAG);
    }

    @Test
    void unclosedFragment_isReported() {
        var outcome = RsxParser.parseRecoverable("<>\"a\"");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.UNTERMINATED_FRAGMENT);
        assertThat(outcome.value().orElseThrow()).hasSize(1);
    }

    @Test
    void strayCloseTag_isSkipped() {
        var outcome = RsxParser.parseRecoverable("</div><p/>");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.UNEXPECTED_CLOSE_TAG);
        assertThat(outcome.value().orElseThrow()).hasSize(1);
    }

    @Test
    void missingAttributeValue_keepsKey() {
        var outcome = RsxParser.parseRecoverable("<a href=></a>");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.MISSING_ATTRIBUTE_VALUE);
        var element = (Node.Element) outcome.value().orElseThrow().get(0);
        var href = (Attribute.Keyed) element.attributes().get(0);
        assertThat(href.key().toString()).isEqualTo("href");
        assertThat(href.value()).isEmpty();
    }

    @Test
    void invalidComment_isReported() {
        var outcome = RsxParser.parseRecoverable("<!-- note -->");

        assertThat(outcome.diagnostics().get(0).kind()).isEqualTo(DiagnosticKind.INVALID_COMMENT);
    }

    @Test
    void invalidDoctype_isReported() {
        var outcome = RsxParser.parseRecoverable("<!html><p/>");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.INVALID_DOCTYPE);
        assertThat(outcome.value().orElseThrow()).hasSize(1);
    }

    @Test
    void lessThanAtEnd_terminates() {
        var outcome = RsxParser.parseRecoverable("<p/><");

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.INVALID_NODE_NAME);
    }

    @Test
    void lexerError_yieldsFailedOutcome() {
        var outcome = RsxParser.parseRecoverable("<div>\"unterminated</div>");

        assertThat(outcome).isInstanceOf(ParseOutcome.Failed.class);
        assertThat(outcome.diagnostics().get(0).message()).isEqualTo("unterminated string literal");
    }

    @Test
    void severalErrors_areAllCollected() {
        var source = """
            <div hello={world.} />
            <>
                <div>"1"</x>
                <div>"2"</div>
                <div {"some-attribute-from-rust-block"}/>
            </>
            <bar>
            """;

        var outcome = RECOVERING.parseRecoverable(source);

        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                                         .containsExactly(DiagnosticKind.INVALID_EMBEDDED_EXPRESSION,
                                                          DiagnosticKind.MISMATCHED_CLOSE_TAG,
                                                          DiagnosticKind.UNTERMINATED_OPEN_TAG);
        assertThat(outcome.value().orElseThrow()).hasSize(3);
        assertThat(outcome.formatDiagnostics(source, "page.rsx")).contains("error[RSX006]")
                                                                  .contains("error[RSX002]")
                                                                  .contains("error[RSX001]");
    }

    @Test
    void diagnosticFreeSubset_parsesToSameTree() {
        var recovered = RsxParser.parseRecoverable("<div><open></close><foo></foo></div>")
                                 .value()
                                 .orElseThrow();
        var clean = RsxParser.parseRecoverable("<div><open></open><foo></foo></div>");

        assertThat(clean).isInstanceOf(ParseOutcome.Ok.class);
        var cleanDiv = clean.value().orElseThrow().get(0);
        var recoveredDiv = recovered.get(0);
        assertThat(cleanDiv.children()).extracting(node -> ((Node.Element) node).name().toString())
                                       .containsExactlyElementsOf(recoveredDiv.children()
                                                                              .stream()
                                                                              .map(node -> ((Node.Element) node).name()
                                                                                                                  .toString())
                                                                              .toList());
    }
}
