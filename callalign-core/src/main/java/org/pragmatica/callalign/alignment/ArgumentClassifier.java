package org.pragmatica.callalign.alignment;

import org.pragmatica.callalign.position.PositionResolver;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies call arguments by looking at the raw source text.
 *
 * Classification is best effort: whenever a span falls outside the text or an offset does not
 * resolve, the answer is {@code false}.
 */
public final class ArgumentClassifier {
    private static final Pattern CLOSURE_START = Pattern.compile("\\s*\\{");

    private final String source;
    private final PositionResolver resolver;

    private ArgumentClassifier(String source, PositionResolver resolver) {
        this.source = source;
        this.resolver = resolver;
    }

    public static ArgumentClassifier argumentClassifier(String source, PositionResolver resolver) {
        return new ArgumentClassifier(source, resolver);
    }

    /**
     * Check whether the argument value is a closure literal, i.e. its body starts with an opening
     * brace, optionally preceded by whitespace.
     */
    public boolean isClosure(Argument argument) {
        return argument.body()
                       .filter(this::withinSource)
                       .map(body -> CLOSURE_START.matcher(source)
                                                 .region(body.offset(), body.end())
                                                 .lookingAt())
                       .orElse(false);
    }

    /**
     * Check whether the argument body starts and ends on different lines.
     */
    public boolean isMultilineClosure(Argument argument) {
        return argument.body()
                       .flatMap(this::spansLines)
                       .orElse(false);
    }

    /**
     * Check whether the call already passes its last argument as a trailing closure.
     *
     * Trailing closure syntax leaves the closing parenthesis before the closure, so the call text
     * does not end with {@code )}.
     */
    public boolean isTrailingClosure(CallSite call) {
        if (!withinSource(call.span())) {
            return false;
        }
        return !source.substring(call.span().offset(), call.span().end())
                      .endsWith(")");
    }

    private Optional<Boolean> spansLines(Span body) {
        return resolver.lineOf(body.offset())
                       .flatMap(startLine -> resolver.lineOf(body.end())
                                                     .map(endLine -> endLine > startLine));
    }

    private boolean withinSource(Span span) {
        return span.end() <= source.length();
    }
}
