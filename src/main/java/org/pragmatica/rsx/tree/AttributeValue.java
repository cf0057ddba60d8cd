package org.pragmatica.rsx.tree;

import org.pragmatica.rsx.host.HostExpression;

import java.util.Optional;

/**
 * Right-hand side of {@code key = value}: a host expression or a braced block.
 */
public sealed interface AttributeValue {
    SourceSpan span();

    /**
     * Value of a plain string literal, also when wrapped in a block.
     */
    Optional<String> stringValue();

    record Expression(HostExpression expression) implements AttributeValue {
        @Override
        public SourceSpan span() {
            return expression.span();
        }

        @Override
        public Optional<String> stringValue() {
            return expression.stringValue();
        }
    }

    record Braced(NodeBlock block) implements AttributeValue {
        @Override
        public SourceSpan span() {
            return block.span();
        }

        @Override
        public Optional<String> stringValue() {
            return block.tryExpression()
                        .flatMap(HostExpression::stringValue);
        }
    }
}
