package org.pragmatica.yard.tree;

/**
 * A range in the raw expression text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    /**
     * Span covering the single character at {@code location}.
     */
    public static SourceSpan single(SourceLocation location) {
        return new SourceSpan(location,
                              SourceLocation.at(location.line(), location.column() + 1, location.offset() + 1));
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
