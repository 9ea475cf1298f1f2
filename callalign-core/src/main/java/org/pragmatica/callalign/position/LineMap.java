package org.pragmatica.callalign.position;

import java.util.Arrays;
import java.util.Optional;

/**
 * Converts between character offsets and (line, column) positions for one source text.
 *
 * The first character is at offset 0 and at position (1,1). A line terminator belongs to the line
 * it terminates; {@code \r\n} counts as a single terminator. Tabs occupy one column, which matches
 * the default column accounting of JavaParser. The offset equal to the text length (end of text)
 * is valid and resolves to the position just after the last character.
 */
public final class LineMap implements PositionResolver {
    private final int[] lineStarts;
    private final int length;

    private LineMap(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineMap lineMap(String text) {
        var starts = new int[16];
        var count = 0;
        starts[count++] = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
            } else if (c != '\r' && c != '\n') {
                continue;
            }

            if (count == starts.length) {
                starts = Arrays.copyOf(starts, count * 2);
            }
            starts[count++] = i + 1;
        }

        return new LineMap(Arrays.copyOf(starts, count), text.length());
    }

    @Override
    public Optional<SourcePosition> resolve(int offset) {
        if (offset < 0 || offset > length) {
            return Optional.empty();
        }

        var index = lineIndex(offset);
        return Optional.of(SourcePosition.sourcePosition(index + 1, offset - lineStarts[index] + 1));
    }

    /**
     * Inverse of {@link #resolve(int)}.
     *
     * @return the offset of the position, or empty if the line does not exist or the column lies
     *         past the end of the text
     */
    public Optional<Integer> offsetOf(SourcePosition position) {
        if (position.line() > lineStarts.length) {
            return Optional.empty();
        }

        var offset = lineStarts[position.line() - 1] + position.column() - 1;
        return offset <= length
               ? Optional.of(offset)
               : Optional.empty();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    private int lineIndex(int offset) {
        var found = Arrays.binarySearch(lineStarts, offset);
        return found >= 0
               ? found
               : -found - 2;
    }
}
