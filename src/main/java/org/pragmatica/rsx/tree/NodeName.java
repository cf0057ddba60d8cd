package org.pragmatica.rsx.tree;

import org.pragmatica.rsx.token.TokenTree;

import java.util.List;

/**
 * Name of an element or attribute key.
 * <p>
 * {@link #toString()} renders the name exactly as written for static names, so {@code <data-foo>} yields
 * {@code data-foo} and {@code <some::path>} yields {@code some::path}.
 */
public sealed interface NodeName {
    SourceSpan span();

    /**
     * Structural equality ignoring spans.
     */
    default boolean matches(NodeName other) {
        return getClass() == other.getClass() && toString().equals(other.toString());
    }

    /**
     * One or more identifiers joined by {@code ::}.
     */
    record SimplePath(List<TokenTree.Ident> segments, SourceSpan span) implements NodeName {
        public SimplePath {
            segments = List.copyOf(segments);
        }

        public boolean isSingleIdent() {
            return segments.size() == 1;
        }

        @Override
        public String toString() {
            var sb = new StringBuilder();
            for (var segment : segments) {
                if (sb.length() > 0) {
                    sb.append("::");
                }
                sb.append(segment.name());
            }
            return sb.toString();
        }
    }

    /**
     * Identifiers joined by {@code -} or {@code :} separators, which may be mixed.
     *
     * @param separators one separator between each pair of parts
     */
    record Punctuated(List<TokenTree.Ident> parts, List<TokenTree.Punct> separators, SourceSpan span)
    implements NodeName {
        public Punctuated {
            parts = List.copyOf(parts);
            separators = List.copyOf(separators);
            if (separators.size() != parts.size() - 1) {
                throw new IllegalArgumentException("Punctuated name needs one separator between each pair of parts");
            }
        }

        @Override
        public String toString() {
            var sb = new StringBuilder(parts.get(0)
                                            .name());
            for (int i = 1; i < parts.size(); i++) {
                sb.append(separators.get(i - 1)
                                    .ch())
                  .append(parts.get(i)
                               .name());
            }
            return sb.toString();
        }
    }

    /**
     * Name computed by a block of host code.
     */
    record Dynamic(NodeBlock block) implements NodeName {
        @Override
        public SourceSpan span() {
            return block.span();
        }

        @Override
        public String toString() {
            return block.text();
        }
    }
}
