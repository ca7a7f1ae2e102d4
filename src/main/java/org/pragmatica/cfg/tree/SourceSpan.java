package org.pragmatica.cfg.tree;

/**
 * A range in grammar notation text from start (inclusive) to end (exclusive).
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

    public String extract(String source) {
        return source.substring(start.offset(), Math.min(end.offset(), source.length()));
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
