package org.pragmatica.rsx.parser;

import org.pragmatica.rsx.error.DiagnosticKind;
import org.pragmatica.rsx.error.RsxParseException;
import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.token.TokenLexer;
import org.pragmatica.rsx.token.TokenStream;
import org.pragmatica.rsx.tree.Node;

import java.util.List;

/**
 * Parser interface - parses a token stream into markup nodes.
 */
public interface Parser {

    /**
     * Parse and fail on the first diagnostic.
     */
    List<Node> parseStrict(TokenStream tokens) throws RsxParseException;

    /**
     * Parse with recovery, returning whatever tree could be built along with every diagnostic.
     */
    ParseOutcome<List<Node>> parseRecoverable(TokenStream tokens);

    /**
     * Tokenize source text with {@link TokenLexer}, then parse strictly.
     */
    default List<Node> parseStrict(String source) throws RsxParseException {
        try{
            return parseStrict(TokenLexer.tokenize(source));
        } catch (SyntaxException e) {
            throw new RsxParseException(e.toDiagnostic(DiagnosticKind.UNEXPECTED_TOKEN));
        }
    }

    /**
     * Tokenize source text with {@link TokenLexer}, then parse with recovery.
     * A tokenizer error yields a failed outcome.
     */
    default ParseOutcome<List<Node>> parseRecoverable(String source) {
        try{
            return parseRecoverable(TokenLexer.tokenize(source));
        } catch (SyntaxException e) {
            return new ParseOutcome.Failed<>(List.of(e.toDiagnostic(DiagnosticKind.UNEXPECTED_TOKEN)));
        }
    }

    ParserConfig config();
}
