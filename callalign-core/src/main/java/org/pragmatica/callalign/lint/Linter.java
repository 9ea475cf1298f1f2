package org.pragmatica.callalign.lint;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.pragmatica.callalign.lint.rules.LintRule;
import org.pragmatica.callalign.lint.rules.LintRules;
import org.pragmatica.callalign.shared.FileCollector;
import org.pragmatica.callalign.shared.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs the enabled lint rules over Java sources.
 *
 * Diagnostics are returned ordered by file, line and column.
 */
public class Linter {
    private static final Logger log = LoggerFactory.getLogger(Linter.class);

    private final LintContext context;
    private final List<LintRule> rules;
    private final ParserConfiguration parserConfiguration;

    private Linter(LintContext context, List<LintRule> rules) {
        this.context = context;
        this.rules = List.copyOf(rules);
        this.parserConfiguration = createParserConfiguration();
    }

    /**
     * Factory method for creating a linter with default config and all known rules.
     */
    public static Linter linter() {
        return linter(LintContext.defaultContext());
    }

    /**
     * Factory method for creating a linter with custom config.
     */
    public static Linter linter(LintConfig config) {
        return linter(LintContext.defaultContext().withConfig(config));
    }

    /**
     * Factory method for creating a linter with custom context (config and package exclusions).
     */
    public static Linter linter(LintContext context) {
        return linter(context, LintRules.allRules());
    }

    /**
     * Factory method for creating a linter with an explicit rule set.
     */
    public static Linter linter(LintContext context, List<LintRule> rules) {
        return new Linter(context, rules);
    }

    /**
     * Rules that run under the current configuration.
     */
    public List<LintRule> activeRules() {
        return rules.stream()
                    .filter(rule -> context.isRuleEnabled(rule.ruleId(), rule.optIn()))
                    .toList();
    }

    /**
     * Lint a single source.
     *
     * @throws LintException if the source does not parse
     */
    public List<Diagnostic> lint(SourceFile source) throws LintException {
        var fileName = source.fileName().toString();
        var cu = parse(fileName, source.content());
        var fileContext = context.withFileName(fileName);
        var activeRules = activeRules();

        log.debug("Linting {} with {} rule(s)", fileName, activeRules.size());

        return activeRules.stream()
                          .flatMap(rule -> rule.analyze(cu, source.content(), fileContext))
                          .sorted(Diagnostic.BY_LOCATION)
                          .toList();
    }

    /**
     * Lint all Java files found under the given paths.
     *
     * Files that cannot be read or parsed are reported to the error handler and skipped.
     */
    public List<Diagnostic> lintPaths(List<Path> paths, Consumer<String> errorHandler) {
        var diagnostics = new ArrayList<Diagnostic>();

        for (var path : FileCollector.collectJavaFiles(paths, errorHandler)) {
            try {
                diagnostics.addAll(lint(SourceFile.sourceFile(path)));
            } catch (IOException e) {
                log.warn("Unable to read {}: {}", path, e.getMessage());
                errorHandler.accept("Error reading " + path + ": " + e.getMessage());
            } catch (LintException e) {
                log.warn("Unable to lint {}: {}", path, e.getMessage());
                errorHandler.accept(e.getMessage());
            }
        }

        return List.copyOf(diagnostics);
    }

    private CompilationUnit parse(String fileName, String content) throws LintException {
        // JavaParser is not thread-safe
        var result = new JavaParser(parserConfiguration).parse(content);

        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }

        var problem = result.getProblems().stream()
                .findFirst()
                .orElse(null);

        if (problem != null) {
            throw parseError(fileName, problem);
        }

        throw LintException.parseError(fileName, 1, 1, "Unknown parse error");
    }

    private static LintException parseError(String fileName, Problem problem) {
        var location = problem.getLocation()
                .map(l -> l.getBegin())
                .orElse(null);

        int line = location != null ? location.getRange().map(r -> r.begin.line).orElse(1) : 1;
        int column = location != null ? location.getRange().map(r -> r.begin.column).orElse(1) : 1;

        return LintException.parseError(fileName, line, column, problem.getMessage());
    }

    private static ParserConfiguration createParserConfiguration() {
        return new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_21);
    }
}
