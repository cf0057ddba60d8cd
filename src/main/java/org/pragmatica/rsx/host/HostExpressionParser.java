package org.pragmatica.rsx.host;

import org.pragmatica.rsx.error.SyntaxException;
import org.pragmatica.rsx.token.TokenInput;
import org.pragmatica.rsx.tree.SourceSpan;

/**
 * Parser of the embedded host language. The markup parser only decides where a host fragment starts and ends;
 * everything inside is delegated here.
 */
public interface HostExpressionParser {

    /**
     * Parse one expression starting at the input position, consuming exactly the tokens that belong to it.
     */
    HostExpression parseExpression(TokenInput input) throws SyntaxException;

    /**
     * Parse the content of a braced block. Every token of {@code content} must be consumed.
     *
     * @param braces span of the whole braced group
     */
    HostExpression parseBlock(TokenInput content, SourceSpan braces) throws SyntaxException;
}
