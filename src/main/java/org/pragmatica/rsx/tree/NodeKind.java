package org.pragmatica.rsx.tree;

/**
 * Discriminant of {@link Node} variants, used by top-level kind constraints.
 */
public enum NodeKind {
    ELEMENT("element"),
    FRAGMENT("fragment"),
    TEXT("text"),
    RAW_TEXT("raw text"),
    COMMENT("comment"),
    DOCTYPE("doctype"),
    BLOCK("block");

    private final String display;

    NodeKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
