package org.pragmatica.callalign.lint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the linter.
 *
 * @param ruleSeverities  severity reported for each rule
 * @param disabledRules   rules that never run
 * @param enabledRules    opt-in rules that were switched on
 * @param failOnWarning   whether warnings block a build the same way errors do
 */
public record LintConfig(
        Map<String, DiagnosticSeverity> ruleSeverities,
        Set<String> disabledRules,
        Set<String> enabledRules,
        boolean failOnWarning
) {

    public LintConfig {
        ruleSeverities = Map.copyOf(ruleSeverities);
        disabledRules = Set.copyOf(disabledRules);
        enabledRules = Set.copyOf(enabledRules);
    }

    /**
     * Default lint configuration.
     */
    public static final LintConfig DEFAULT = new LintConfig(
            Map.ofEntries(
                    // Formatting
                    Map.entry("ALIGN-CALL-01", DiagnosticSeverity.WARNING)  // Vertical parameter alignment on call
            ),
            Set.of(),
            Set.of(),
            false
    );

    /**
     * Factory method for default config.
     */
    public static LintConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Builder-style method to set rule severity.
     */
    public LintConfig withRuleSeverity(String ruleId, DiagnosticSeverity severity) {
        var newSeverities = new HashMap<>(ruleSeverities);
        newSeverities.put(ruleId, severity);
        return new LintConfig(newSeverities, disabledRules, enabledRules, failOnWarning);
    }

    /**
     * Builder-style method to disable a rule.
     */
    public LintConfig withDisabledRule(String ruleId) {
        var newDisabled = new HashSet<>(disabledRules);
        newDisabled.add(ruleId);
        return new LintConfig(ruleSeverities, newDisabled, enabledRules, failOnWarning);
    }

    /**
     * Builder-style method to switch on an opt-in rule.
     */
    public LintConfig withEnabledRule(String ruleId) {
        var newEnabled = new HashSet<>(enabledRules);
        newEnabled.add(ruleId);
        return new LintConfig(ruleSeverities, disabledRules, newEnabled, failOnWarning);
    }

    /**
     * Builder-style method to set fail on warning.
     */
    public LintConfig withFailOnWarning(boolean failOnWarning) {
        return new LintConfig(ruleSeverities, disabledRules, enabledRules, failOnWarning);
    }

    /**
     * Check whether the diagnostics should fail a build under this configuration.
     */
    public boolean hasBlockingDiagnostics(List<Diagnostic> diagnostics) {
        var threshold = failOnWarning ? DiagnosticSeverity.WARNING : DiagnosticSeverity.ERROR;

        return diagnostics.stream()
                          .anyMatch(diagnostic -> diagnostic.severity().isAtLeast(threshold));
    }
}
