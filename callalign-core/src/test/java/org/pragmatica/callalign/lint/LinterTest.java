package org.pragmatica.callalign.lint;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.callalign.lint.rules.LintRule;
import org.pragmatica.callalign.shared.SourceFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinterTest {
    private static final String RULE_ID = "ALIGN-CALL-01";

    private static final String MISALIGNED = """
            class Sample {
                void run() {
                    process(first,
                      second);
                }
            }
            """;

    private final LintConfig enabled = LintConfig.defaultConfig()
                                                 .withEnabledRule(RULE_ID);

    @Test
    void lint_skipsOptInRule_byDefault() throws LintException {
        var linter = Linter.linter();

        assertThat(linter.activeRules()).isEmpty();
        assertThat(linter.lint(source(MISALIGNED))).isEmpty();
    }

    @Test
    void lint_runsOptInRule_whenEnabled() throws LintException {
        var linter = Linter.linter(enabled);

        assertThat(linter.activeRules()).extracting(LintRule::ruleId)
                                        .containsExactly(RULE_ID);
        assertThat(linter.lint(source(MISALIGNED))).hasSize(1);
    }

    @Test
    void lint_skipsDisabledRule_evenWhenEnabled() throws LintException {
        var linter = Linter.linter(enabled.withDisabledRule(RULE_ID));

        assertThat(linter.lint(source(MISALIGNED))).isEmpty();
    }

    @Test
    void lint_throwsParseError_forInvalidSyntax() {
        var linter = Linter.linter(enabled);
        var source = source("""
                class Invalid {
                    void run() {
                        process(first,
                """);

        assertThatThrownBy(() -> linter.lint(source))
                .isInstanceOf(LintException.class)
                .hasMessageContaining("Sample.java")
                .hasMessageContaining("Parse error")
                .satisfies(error -> assertThat(((LintException) error).fileName()).isEqualTo("Sample.java"));
    }

    @Test
    void lint_reportsLocation_inDiagnostic() throws LintException {
        var diagnostics = Linter.linter(enabled)
                                .lint(source(MISALIGNED));

        assertThat(diagnostics.get(0).location()).isEqualTo("Sample.java:4:11");
    }

    @Test
    void lint_checksCalls_inSourceWithRecordAndSwitchPatterns() throws LintException {
        var diagnostics = Linter.linter(enabled)
                                .lint(source("""
                                        class Sample {
                                            record Point(int x, int y) {}

                                            int run(Object o) {
                                                if (o instanceof Point(int x, int y)) {
                                                    process(x,
                                                      y);
                                                }
                                                return switch (o) {
                                                    case Point p -> p.x();
                                                    default -> 0;
                                                };
                                            }
                                        }
                                        """));

        assertThat(diagnostics).extracting(Diagnostic::location)
                               .containsExactly("Sample.java:7:15");
    }

    @Test
    void lintPaths_lintsEveryJavaFile_andReportsBrokenOnes(@TempDir Path root) throws IOException {
        var nested = Files.createDirectories(root.resolve("com/example"));
        Files.writeString(nested.resolve("Sample.java"), MISALIGNED);
        Files.writeString(nested.resolve("Broken.java"), "class Broken {");
        Files.writeString(nested.resolve("notes.txt"), "process(a,\n b);");
        var errors = new ArrayList<String>();

        var diagnostics = Linter.linter(enabled)
                                .lintPaths(List.of(root), errors::add);

        assertThat(diagnostics).extracting(Diagnostic::file)
                               .containsExactly(nested.resolve("Sample.java").toString());
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).contains("Broken.java");
    }

    @Test
    void lintPaths_returnsEmpty_forMissingPath(@TempDir Path root) {
        var errors = new ArrayList<String>();

        var diagnostics = Linter.linter(enabled)
                                .lintPaths(List.of(root.resolve("missing.java")), errors::add);

        assertThat(diagnostics).isEmpty();
        assertThat(errors).hasSize(1);
    }

    private static SourceFile source(String content) {
        return new SourceFile(Path.of("Sample.java"), content);
    }
}
