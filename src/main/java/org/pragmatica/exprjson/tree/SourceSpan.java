package org.pragmatica.exprjson.tree;

/**
 * A range in expression source from start (inclusive) to end (exclusive).
 * Spans are used for diagnostics only and never reach the converted output.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    /**
     * Split this span after {@code count} characters. Only meaningful for single-line spans.
     */
    public SourceSpan[] splitAt(int count) {
        var middle = start.shift(count);
        return new SourceSpan[]{new SourceSpan(start, middle), new SourceSpan(middle, end)};
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
