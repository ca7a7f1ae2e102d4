package org.pragmatica.cfg.tree;

/**
 * A position in grammar notation text (line and column 1-based, offset 0-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location immediately after {@code consumed}, which must be the character at this location.
     */
    public SourceLocation next(char consumed) {
        return consumed == '\n'
               ? new SourceLocation(line + 1, 1, offset + 1)
               : new SourceLocation(line, column + 1, offset + 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
