package org.pragmatica.callalign.alignment;

import java.util.List;
import java.util.Objects;

/**
 * A call expression with its arguments in source order.
 *
 * @param span      the whole call expression text, callee included
 * @param arguments arguments in source order
 */
public record CallSite(Span span, List<Argument> arguments) {
    public CallSite {
        Objects.requireNonNull(span, "span");
        arguments = List.copyOf(arguments);
    }

    public static CallSite callSite(Span span, List<Argument> arguments) {
        return new CallSite(span, arguments);
    }

    public boolean isLastArgument(int index) {
        return index == arguments.size() - 1;
    }
}
