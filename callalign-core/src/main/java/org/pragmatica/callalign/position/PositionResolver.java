package org.pragmatica.callalign.position;

import java.util.Optional;

/**
 * Maps character offsets into source text to line/column positions.
 */
@FunctionalInterface
public interface PositionResolver {

    /**
     * Resolve an offset to its position.
     *
     * @param offset character offset from the beginning of the text (first character is 0)
     * @return the position, or empty if the offset lies outside the text
     */
    Optional<SourcePosition> resolve(int offset);

    /**
     * Resolve only the line of an offset.
     */
    default Optional<Integer> lineOf(int offset) {
        return resolve(offset).map(SourcePosition::line);
    }
}
