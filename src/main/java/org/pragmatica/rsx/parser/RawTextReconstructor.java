package org.pragmatica.rsx.parser;

import org.pragmatica.rsx.token.SourceTextProvider;
import org.pragmatica.rsx.token.TokenStream;
import org.pragmatica.rsx.tree.Node;
import org.pragmatica.rsx.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns {@link Node.RawText} back into text, as close to the source as the host allows.
 * <ol>
 *   <li>verbatim source between the boundaries around the run, whitespace included</li>
 *   <li>verbatim source of the run itself</li>
 *   <li>canonical token rendering</li>
 * </ol>
 * The first two need a {@link SourceTextProvider}; without one only the last is available.
 */
public final class RawTextReconstructor {
    private final Optional<SourceTextProvider> source;

    public RawTextReconstructor(Optional<SourceTextProvider> source) {
        this.source = source;
    }

    public static RawTextReconstructor of(TokenStream stream) {
        return new RawTextReconstructor(stream.source());
    }

    public static RawTextReconstructor withoutSource() {
        return new RawTextReconstructor(Optional.empty());
    }

    /**
     * Source text of the run, optionally with the whitespace around it up to the neighbouring boundaries.
     */
    public Optional<String> toSourceText(Node.RawText raw, boolean withWhitespace) {
        if (source.isEmpty()) {
            return Optional.empty();
        }
        var provider = source.get();
        if (!withWhitespace) {
            var span = raw.span();
            return span.isKnown()
                   ? provider.textOf(span)
                   : Optional.empty();
        }
        return raw.boundaries()
                  .flatMap(boundaries -> between(provider, boundaries.before(), boundaries.after()));
    }

    /**
     * Best available rendering; never fails.
     */
    public String toStringBest(Node.RawText raw) {
        return toSourceText(raw, true).or(() -> toSourceText(raw, false))
                                      .orElseGet(raw::toTokenString);
    }

    private static Optional<String> between(SourceTextProvider provider, SourceSpan before, SourceSpan after) {
        var full = provider.join(before, after)
                           .flatMap(provider::textOf);
        var start = provider.textOf(before);
        var end = provider.textOf(after);
        if (full.isEmpty() || start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        var text = full.get();
        int from = start.get()
                        .length();
        int to = text.length() - end.get()
                                    .length();
        if (from > to || !text.startsWith(start.get()) || !text.endsWith(end.get())) {
            return Optional.empty();
        }
        return Optional.of(text.substring(from, to));
    }

    /**
     * Give every raw text child the spans of its neighbours: the open tag end or previous sibling before it,
     * the next sibling or close tag start after it. A child missing either neighbour gets no boundaries, which
     * happens at the edges of the top level and after the last child of an unclosed container.
     */
    static List<Node> assignBoundaries(Optional<SourceSpan> openEnd,
                                       List<Node> children,
                                       Optional<SourceSpan> closeStart) {
        var spans = new ArrayList<SourceSpan>(children.size() + 2);
        openEnd.ifPresent(spans::add);
        children.forEach(child -> spans.add(child.span()));
        closeStart.ifPresent(spans::add);

        int offset = openEnd.isPresent() ? 1 : 0;
        var result = new ArrayList<Node>(children.size());
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            int at = i + offset;
            if (child instanceof Node.RawText raw && at >= 1 && at + 1 < spans.size()) {
                child = raw.withBoundaries(spans.get(at - 1), spans.get(at + 1));
            }
            result.add(child);
        }
        return result;
    }
}
