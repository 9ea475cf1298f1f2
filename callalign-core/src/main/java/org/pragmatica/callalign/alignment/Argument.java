package org.pragmatica.callalign.alignment;

import java.util.Objects;
import java.util.Optional;

/**
 * One argument of a call site.
 *
 * @param offset start offset of the argument (label included, if the language has labels)
 * @param body   span of the argument value, present only when the value is a closure literal
 */
public record Argument(int offset, Optional<Span> body) {
    public Argument {
        if (offset < 0) {
            throw new IllegalArgumentException("Argument offset must not be negative, got " + offset);
        }
        Objects.requireNonNull(body, "body");
    }

    /**
     * Plain argument without a closure body.
     */
    public static Argument argument(int offset) {
        return new Argument(offset, Optional.empty());
    }

    /**
     * Argument whose value is a closure literal occupying the given body span.
     */
    public static Argument closureArgument(int offset, Span body) {
        return new Argument(offset, Optional.of(body));
    }
}
