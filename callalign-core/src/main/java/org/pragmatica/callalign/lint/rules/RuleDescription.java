package org.pragmatica.callalign.lint.rules;

import java.util.List;

/**
 * Static description of a lint rule.
 *
 * Triggering examples mark every expected violation with {@value #VIOLATION_MARKER} placed right
 * before the reported position; the marker is not part of the source.
 *
 * @param identifier            rule ID used in configuration and diagnostics
 * @param name                  human readable name
 * @param description           what the rule checks
 * @param nonTriggeringExamples sources the rule accepts
 * @param triggeringExamples    sources the rule reports, with violation markers
 */
public record RuleDescription(String identifier,
                              String name,
                              String description,
                              List<String> nonTriggeringExamples,
                              List<String> triggeringExamples) {
    public static final String VIOLATION_MARKER = "↓";

    public RuleDescription {
        nonTriggeringExamples = List.copyOf(nonTriggeringExamples);
        triggeringExamples = List.copyOf(triggeringExamples);
    }
}
