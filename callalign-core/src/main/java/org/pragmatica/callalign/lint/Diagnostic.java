package org.pragmatica.callalign.lint;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A single finding reported by a lint rule.
 *
 * @param ruleId   rule that produced the finding
 * @param severity configured severity of the rule
 * @param file     name of the linted file
 * @param line     one-based line
 * @param column   one-based column
 * @param message  short description of the problem
 * @param detail   longer explanation
 * @param example  optional before/after snippet
 */
public record Diagnostic(String ruleId,
                         DiagnosticSeverity severity,
                         String file,
                         int line,
                         int column,
                         String message,
                         String detail,
                         Optional<String> example) {

    /**
     * Order of diagnostics within a report.
     */
    public static final Comparator<Diagnostic> BY_LOCATION = Comparator.comparing(Diagnostic::file)
                                                                       .thenComparingInt(Diagnostic::line)
                                                                       .thenComparingInt(Diagnostic::column)
                                                                       .thenComparing(Diagnostic::ruleId);

    public Diagnostic {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(example, "example");
    }

    /**
     * Factory method for a diagnostic without example.
     */
    public static Diagnostic diagnostic(String ruleId,
                                        DiagnosticSeverity severity,
                                        String file,
                                        int line,
                                        int column,
                                        String message,
                                        String detail) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, Optional.empty());
    }

    public Diagnostic withExample(String example) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, Optional.of(example));
    }

    /**
     * Location in {@code file:line:column} form.
     */
    public String location() {
        return file + ":" + line + ":" + column;
    }
}
