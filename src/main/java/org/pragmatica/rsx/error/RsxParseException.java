package org.pragmatica.rsx.error;

/**
 * Terminal error of a strict parse: carries the first diagnostic that was recorded.
 */
public class RsxParseException extends Exception {
    private final Diagnostic diagnostic;

    public RsxParseException(Diagnostic diagnostic) {
        super(diagnostic.formatSimple());
        this.diagnostic = diagnostic;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }

    public DiagnosticKind kind() {
        return diagnostic.kind();
    }
}
