package org.pragmatica.callalign.lint.rules;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.pragmatica.callalign.lint.LintConfig;
import org.pragmatica.callalign.lint.LintException;
import org.pragmatica.callalign.lint.Linter;
import org.pragmatica.callalign.position.LineMap;
import org.pragmatica.callalign.position.SourcePosition;
import org.pragmatica.callalign.shared.SourceFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.callalign.lint.rules.RuleDescription.VIOLATION_MARKER;

/**
 * Runs the examples published in every rule description.
 *
 * Examples are statements; they are placed at column 1 inside a method body, so columns in the
 * example text are the columns the linter sees.
 */
class RuleExamplesTest {

    static Stream<String> nonTriggeringExamples() {
        return LintRules.allRules()
                        .stream()
                        .flatMap(rule -> rule.describe().nonTriggeringExamples().stream());
    }

    static Stream<String> triggeringExamples() {
        return LintRules.allRules()
                        .stream()
                        .flatMap(rule -> rule.describe().triggeringExamples().stream());
    }

    @ParameterizedTest
    @MethodSource("nonTriggeringExamples")
    void nonTriggeringExample_producesNoDiagnostics(String example) throws LintException {
        assertThat(lint(wrap(example))).isEmpty();
    }

    @ParameterizedTest
    @MethodSource("triggeringExamples")
    void triggeringExample_reportsEveryMarkedPosition(String example) throws LintException {
        var marked = wrap(example);
        var source = marked.replace(VIOLATION_MARKER, "");

        assertThat(example).contains(VIOLATION_MARKER);
        assertThat(lint(source)).containsExactlyElementsOf(markedPositions(marked, source));
    }

    private static List<SourcePosition> lint(String source) throws LintException {
        var config = LintConfig.defaultConfig();
        var linter = Linter.linter(LintRules.allRules()
                                            .stream()
                                            .map(LintRule::ruleId)
                                            .reduce(config, LintConfig::withEnabledRule, (left, right) -> right));

        return linter.lint(new SourceFile(Path.of("Example.java"), source))
                     .stream()
                     .map(diagnostic -> SourcePosition.sourcePosition(diagnostic.line(), diagnostic.column()))
                     .toList();
    }

    private static List<SourcePosition> markedPositions(String marked, String source) {
        var lineMap = LineMap.lineMap(source);
        var positions = new ArrayList<SourcePosition>();
        var markerIndex = marked.indexOf(VIOLATION_MARKER);

        while (markerIndex >= 0) {
            lineMap.resolve(markerIndex - positions.size())
                   .ifPresent(positions::add);
            markerIndex = marked.indexOf(VIOLATION_MARKER, markerIndex + 1);
        }
        return positions;
    }

    private static String wrap(String example) {
        return "class Example {\n" +
               "    void example() {\n" +
               example + "\n" +
               "    }\n" +
               "}\n";
    }
}
