package org.pragmatica.callalign.position;

/**
 * Location in source text using one-based line and column coordinates.
 *
 * @param line   one-based line number
 * @param column one-based column number, counted in characters
 */
public record SourcePosition(int line, int column) {
    public SourcePosition {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Position must be one-based, got " + line + ":" + column);
        }
    }

    public static SourcePosition sourcePosition(int line, int column) {
        return new SourcePosition(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
