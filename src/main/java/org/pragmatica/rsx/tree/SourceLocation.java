package org.pragmatica.rsx.tree;

/**
 * A position in source text (line and column, both 1-based).
 * <p>
 * Tokens built by a host without source positions use {@link #UNKNOWN}, whose offset is negative.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);
    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0, -1);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isKnown() {
        return offset >= 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?:?";
    }
}
