package org.pragmatica.rsx.error;

import org.pragmatica.rsx.tree.SourceSpan;

/**
 * Token-level syntax error raised by the lexer, the token input helpers and host expression parsers.
 * The recoverable engine converts it into a {@link Diagnostic}.
 */
public class SyntaxException extends Exception {
    private final SourceSpan span;

    public SyntaxException(String message, SourceSpan span) {
        super(message);
        this.span = span;
    }

    public SourceSpan span() {
        return span;
    }

    public Diagnostic toDiagnostic(DiagnosticKind kind) {
        return Diagnostic.error(kind, getMessage(), span);
    }
}
