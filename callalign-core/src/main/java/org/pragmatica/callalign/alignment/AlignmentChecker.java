package org.pragmatica.callalign.alignment;

import org.pragmatica.callalign.position.PositionResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.pragmatica.callalign.alignment.ArgumentDecision.argumentDecision;

/**
 * Decides which arguments of a multi-line call are not vertically aligned with the first one.
 *
 * The arguments are walked once, left to right. The first argument fixes the reference position.
 * Every line is judged by the first argument that starts it: the argument is misaligned when its
 * column differs from the reference column, except in two cases:
 * <ul>
 *     <li>the previous argument was a closure spanning several lines - the argument becomes the new
 *     reference for everything that follows;</li>
 *     <li>the argument is the last one, is a closure, and the call uses trailing closure syntax.</li>
 * </ul>
 * Arguments that continue the reference line, or share a line with an argument judged earlier,
 * are never reported.
 *
 * <pre>
 * foo(param1: 1, param2: bar
 *     param3: false, param4: true)      // aligned
 *
 * foo(param1: 1, param2: bar
 *  param3: false, param4: true)         // param3 misaligned, param4 shares its line
 * </pre>
 */
public final class AlignmentChecker {
    private final ArgumentClassifier classifier;
    private final PositionResolver resolver;

    private AlignmentChecker(ArgumentClassifier classifier, PositionResolver resolver) {
        this.classifier = classifier;
        this.resolver = resolver;
    }

    public static AlignmentChecker alignmentChecker(String source, PositionResolver resolver) {
        return new AlignmentChecker(ArgumentClassifier.argumentClassifier(source, resolver), resolver);
    }

    /**
     * Offsets of the misaligned arguments, in source order.
     *
     * @return empty set if the call has fewer than two arguments or the first argument
     *         cannot be resolved
     */
    public Set<Integer> check(CallSite call) {
        var flagged = new LinkedHashSet<Integer>();

        for (var decision : decide(call)) {
            if (decision.verdict().isViolation()) {
                flagged.add(decision.argument().offset());
            }
        }

        return Collections.unmodifiableSet(flagged);
    }

    /**
     * Verdict for every argument of the call, in source order.
     *
     * @return empty list if the check does not apply to the call
     */
    public List<ArgumentDecision> decide(CallSite call) {
        var arguments = call.arguments();

        if (arguments.size() < 2) {
            return List.of();
        }

        var first = resolver.resolve(arguments.get(0).offset());

        if (first.isEmpty()) {
            return List.of();
        }

        var state = new AlignmentState(first.get());
        var decisions = new ArrayList<ArgumentDecision>(arguments.size());

        for (int i = 0; i < arguments.size(); i++) {
            var argument = arguments.get(i);
            var closureArgument = classifier.isClosure(argument);

            decisions.add(decide(call, i, closureArgument, state));

            // Carried into the next argument whatever the verdict was
            state.previousWasMultilineClosure(closureArgument && classifier.isMultilineClosure(argument));
        }

        return List.copyOf(decisions);
    }

    private ArgumentDecision decide(CallSite call, int index, boolean closureArgument, AlignmentState state) {
        var argument = call.arguments().get(index);
        var resolved = resolver.resolve(argument.offset());

        if (resolved.isEmpty()) {
            return argumentDecision(argument, resolved, ArgumentVerdict.UNRESOLVED);
        }

        var position = resolved.get();

        if (position.line() <= state.reference().line()) {
            return argumentDecision(argument, resolved, ArgumentVerdict.SAME_LINE);
        }

        var firstVisit = state.visit(position.line());

        if (position.column() == state.reference().column()) {
            return argumentDecision(argument, resolved, ArgumentVerdict.ALIGNED);
        }

        if (!firstVisit) {
            return argumentDecision(argument, resolved, ArgumentVerdict.ALREADY_JUDGED_LINE);
        }

        if (state.previousWasMultilineClosure()) {
            state.realignTo(position);
            return argumentDecision(argument, resolved, ArgumentVerdict.REALIGNED);
        }

        if (call.isLastArgument(index) && closureArgument && classifier.isTrailingClosure(call)) {
            return argumentDecision(argument, resolved, ArgumentVerdict.TRAILING_CLOSURE);
        }

        return argumentDecision(argument, resolved, ArgumentVerdict.MISALIGNED);
    }
}
