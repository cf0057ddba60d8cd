package org.pragmatica.rsx.token;

import org.pragmatica.rsx.tree.SourceSpan;

import java.util.Optional;

/**
 * Optional host capability: access to the verbatim source behind token spans.
 */
public interface SourceTextProvider {

    /**
     * Verbatim source covered by the span, if the host can provide it.
     */
    Optional<String> textOf(SourceSpan span);

    /**
     * Span covering both spans, if they come from the same source.
     */
    default Optional<SourceSpan> join(SourceSpan first, SourceSpan second) {
        return first.join(second);
    }
}
