package org.pragmatica.rsx.tree;

import java.util.Optional;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static final SourceSpan UNKNOWN = new SourceSpan(SourceLocation.UNKNOWN, SourceLocation.UNKNOWN);

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public boolean isKnown() {
        return start.isKnown() && end.isKnown();
    }

    public int length() {
        return isKnown() ? end.offset() - start.offset() : 0;
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    /**
     * Smallest span covering both spans. Unknown spans absorb nothing: joining with one yields the other.
     */
    public SourceSpan merge(SourceSpan other) {
        if (!isKnown()) {
            return other;
        }
        if (!other.isKnown()) {
            return this;
        }
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    /**
     * Join two known spans, where {@code this} must not start after {@code other}.
     */
    public Optional<SourceSpan> join(SourceSpan other) {
        if (!isKnown() || !other.isKnown() || start.offset() > other.start.offset()) {
            return Optional.empty();
        }
        return Optional.of(merge(other));
    }

    /**
     * Zero-width span at the end of this span.
     */
    public SourceSpan endPoint() {
        return at(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
