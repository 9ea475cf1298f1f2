package org.pragmatica.callalign.alignment;

import org.pragmatica.callalign.position.SourcePosition;

import java.util.Optional;

/**
 * Verdict reached for one argument, together with the position it was judged at.
 */
public record ArgumentDecision(Argument argument, Optional<SourcePosition> position, ArgumentVerdict verdict) {
    public static ArgumentDecision argumentDecision(Argument argument,
                                                    Optional<SourcePosition> position,
                                                    ArgumentVerdict verdict) {
        return new ArgumentDecision(argument, position, verdict);
    }
}
