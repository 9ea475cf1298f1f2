package org.pragmatica.callalign.alignment;

/**
 * Range of source text given as start offset and length.
 */
public record Span(int offset, int length) {
    public Span {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Span offset and length must not be negative, got "
                                               + offset + "+" + length);
        }
    }

    public static Span span(int offset, int length) {
        return new Span(offset, length);
    }

    /**
     * Offset just past the last character of the span.
     */
    public int end() {
        return offset + length;
    }
}
