package org.pragmatica.rsx.tree;

import java.util.Optional;

/**
 * Attribute of an open tag.
 */
public sealed interface Attribute {
    SourceSpan span();

    /**
     * {@code key}, {@code key=value} or {@code key={block}}.
     */
    record Keyed(NodeName key, Optional<AttributeValue> value, SourceSpan span) implements Attribute {
        /**
         * Value as a string when it is a string literal.
         */
        public Optional<String> valueAsString() {
            return value.flatMap(AttributeValue::stringValue);
        }
    }

    /**
     * Attribute computed by a bare block, as in {@code <div {attrs} />}.
     */
    record Dynamic(NodeBlock block) implements Attribute {
        @Override
        public SourceSpan span() {
            return block.span();
        }
    }
}
