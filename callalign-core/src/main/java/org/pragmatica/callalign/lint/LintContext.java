package org.pragmatica.callalign.lint;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Context for lint analysis providing configuration.
 */
public record LintContext(List<Pattern> excludedPackagePatterns,
                          LintConfig config,
                          String fileName) {
    public LintContext {
        excludedPackagePatterns = List.copyOf(excludedPackagePatterns);
    }

    /**
     * Check if a package should be linted (not in excluded list).
     */
    public boolean shouldLint(String packageName) {
        if (excludedPackagePatterns.isEmpty()) {
            return true;
        }
        return excludedPackagePatterns.stream()
                                      .noneMatch(pattern -> pattern.matcher(packageName)
                                                                   .matches());
    }

    /**
     * Get the configured severity for a rule.
     */
    public DiagnosticSeverity severityFor(String ruleId) {
        return config.ruleSeverities()
                     .getOrDefault(ruleId, DiagnosticSeverity.WARNING);
    }

    /**
     * Check if a rule should run. Opt-in rules run only when enabled explicitly.
     */
    public boolean isRuleEnabled(String ruleId, boolean optIn) {
        if (config.disabledRules()
                  .contains(ruleId)) {
            return false;
        }
        return !optIn || config.enabledRules()
                               .contains(ruleId);
    }

    /**
     * Factory method with default configuration.
     */
    public static LintContext defaultContext() {
        return new LintContext(List.of(),
                               LintConfig.defaultConfig(),
                               "Unknown.java");
    }

    /**
     * Factory method with custom excluded package patterns.
     */
    public static LintContext lintContext(List<String> excludePackages) {
        return new LintContext(compile(excludePackages), LintConfig.defaultConfig(), "Unknown.java");
    }

    private static List<Pattern> compile(List<String> globs) {
        return globs.stream()
                    .map(LintContext::globToRegex)
                    .map(Pattern::compile)
                    .toList();
    }

    private static String globToRegex(String glob) {
        // Use placeholder to avoid ** being affected by * replacement
        return glob.replace(".", "\\.")
                   .replace("**", "\0DOTSTAR\0")
                   .replace("*", "[^.]*")
                   .replace("\0DOTSTAR\0", ".*");
    }

    /**
     * Builder-style method to set config.
     */
    public LintContext withConfig(LintConfig config) {
        return new LintContext(excludedPackagePatterns, config, fileName);
    }

    /**
     * Builder-style method to set file name.
     */
    public LintContext withFileName(String fileName) {
        return new LintContext(excludedPackagePatterns, config, fileName);
    }

    /**
     * Builder-style method to set excluded package patterns from glob strings.
     */
    public LintContext withExcludePackages(List<String> patterns) {
        return new LintContext(compile(patterns), config, fileName);
    }
}
