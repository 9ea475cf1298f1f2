package org.pragmatica.callalign.lint;

/**
 * Raised when a source file cannot be linted at all.
 */
public class LintException extends Exception {
    private final String fileName;
    private final int line;
    private final int column;

    private LintException(String fileName, int line, int column, String message) {
        super(fileName + ":" + line + ":" + column + ": " + message);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    /**
     * The source does not parse.
     */
    public static LintException parseError(String fileName, int line, int column, String details) {
        return new LintException(fileName, line, column, "Parse error: " + details);
    }

    public String fileName() {
        return fileName;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
