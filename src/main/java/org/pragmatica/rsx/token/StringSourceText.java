package org.pragmatica.rsx.token;

import org.pragmatica.rsx.tree.SourceSpan;

import java.util.Optional;

/**
 * Source text provider backed by the in-memory text the tokens were lexed from.
 */
public record StringSourceText(String source) implements SourceTextProvider {

    @Override
    public Optional<String> textOf(SourceSpan span) {
        if (!span.isKnown() || span.end()
                                   .offset() > source.length()) {
            return Optional.empty();
        }
        return Optional.of(span.extract(source));
    }
}
