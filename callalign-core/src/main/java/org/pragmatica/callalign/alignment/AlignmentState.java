package org.pragmatica.callalign.alignment;

import org.pragmatica.callalign.position.SourcePosition;

import java.util.HashSet;
import java.util.Set;

/**
 * Running state of one alignment walk over the arguments of a single call.
 *
 * Created per call and never shared.
 */
final class AlignmentState {
    private final Set<Integer> visitedLines = new HashSet<>();
    private SourcePosition reference;
    private boolean previousWasMultilineClosure;

    AlignmentState(SourcePosition reference) {
        this.reference = reference;
    }

    SourcePosition reference() {
        return reference;
    }

    void realignTo(SourcePosition position) {
        reference = position;
    }

    /**
     * Mark the line as visited.
     *
     * @return true if this is the first visit of the line
     */
    boolean visit(int line) {
        return visitedLines.add(line);
    }

    boolean previousWasMultilineClosure() {
        return previousWasMultilineClosure;
    }

    void previousWasMultilineClosure(boolean value) {
        previousWasMultilineClosure = value;
    }
}
