package org.pragmatica.callalign.lint.rules;

import java.util.List;

/**
 * Registry of the available lint rules.
 */
public final class LintRules {

    private LintRules() {}

    public static List<LintRule> allRules() {
        return List.of(new VerticalParameterAlignmentOnCallRule());
    }
}
