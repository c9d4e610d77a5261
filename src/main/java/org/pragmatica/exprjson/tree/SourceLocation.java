package org.pragmatica.exprjson.tree;

/**
 * A position in expression source. Line and column are 1-based, offset is 0-based.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location {@code count} characters further on the same line.
     */
    public SourceLocation shift(int count) {
        return new SourceLocation(line, column + count, offset + count);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
