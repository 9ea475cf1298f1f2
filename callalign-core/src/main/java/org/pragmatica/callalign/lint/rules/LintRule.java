package org.pragmatica.callalign.lint.rules;

import com.github.javaparser.ast.CompilationUnit;
import org.pragmatica.callalign.lint.Diagnostic;
import org.pragmatica.callalign.lint.LintContext;

import java.util.stream.Stream;

/**
 * Interface for lint rules.
 *
 * Each rule analyzes a compilation unit and produces zero or more diagnostics.
 */
public interface LintRule {

    /**
     * Get the rule description, including accepted and rejected examples.
     */
    RuleDescription describe();

    /**
     * Get the rule ID (e.g., "ALIGN-CALL-01").
     */
    default String ruleId() {
        return describe().identifier();
    }

    /**
     * Get a short description of what this rule checks.
     */
    default String description() {
        return describe().description();
    }

    /**
     * Whether the rule runs only when enabled in the configuration.
     */
    default boolean optIn() {
        return false;
    }

    /**
     * Analyze a compilation unit and return any diagnostics.
     *
     * @param cu     the compilation unit to analyze
     * @param source the exact text the compilation unit was parsed from
     * @param ctx    the lint context providing configuration
     * @return stream of diagnostics found
     */
    Stream<Diagnostic> analyze(CompilationUnit cu, String source, LintContext ctx);
}
