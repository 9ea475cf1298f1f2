package org.pragmatica.callalign.lint;

/**
 * Severity of a lint diagnostic.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO;

    public boolean isAtLeast(DiagnosticSeverity other) {
        return ordinal() <= other.ordinal();
    }
}
