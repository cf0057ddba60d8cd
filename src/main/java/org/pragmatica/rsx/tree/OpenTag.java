package org.pragmatica.rsx.tree;

import java.util.List;

/**
 * @param selfClosing whether the tag was written with a trailing {@code /}
 * @param end         span of the closing {@code >}
 */
public record OpenTag(NodeName name, List<Attribute> attributes, boolean selfClosing, SourceSpan span, SourceSpan end) {
    public OpenTag {
        attributes = List.copyOf(attributes);
    }
}
