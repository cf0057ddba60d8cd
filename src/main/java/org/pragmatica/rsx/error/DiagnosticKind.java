package org.pragmatica.rsx.error;

/**
 * Categories of parse diagnostics, each with a stable code shown in formatted output.
 */
public enum DiagnosticKind {
    UNTERMINATED_OPEN_TAG("RSX001"),
    MISMATCHED_CLOSE_TAG("RSX002"),
    UNEXPECTED_CLOSE_TAG("RSX003"),
    INVALID_NODE_NAME("RSX004"),
    MISSING_ATTRIBUTE_VALUE("RSX005"),
    INVALID_EMBEDDED_EXPRESSION("RSX006"),
    UNTERMINATED_FRAGMENT("RSX007"),
    TOP_LEVEL_CARDINALITY_VIOLATION("RSX008"),
    TOP_LEVEL_KIND_VIOLATION("RSX009"),
    UNEXPECTED_END_OF_INPUT("RSX010"),
    NESTING_TOO_DEEP("RSX011"),
    INVALID_DOCTYPE("RSX012"),
    INVALID_COMMENT("RSX013"),
    UNEXPECTED_TOKEN("RSX014");

    private final String code;

    DiagnosticKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
