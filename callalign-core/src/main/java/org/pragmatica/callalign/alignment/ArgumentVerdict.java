package org.pragmatica.callalign.alignment;

/**
 * Outcome of the alignment check for a single argument.
 */
public enum ArgumentVerdict {
    /** Argument offset does not resolve to a position. */
    UNRESOLVED,
    /** Argument continues the line of the reference argument. */
    SAME_LINE,
    /** Argument starts a new line at the reference column. */
    ALIGNED,
    /** Another argument already started this line and was judged for it. */
    ALREADY_JUDGED_LINE,
    /** First argument on a new line after a multi-line closure; becomes the new reference. */
    REALIGNED,
    /** Last argument passed with trailing closure syntax. */
    TRAILING_CLOSURE,
    /** Argument starts a new line at a different column. */
    MISALIGNED;

    public boolean isViolation() {
        return this == MISALIGNED;
    }
}
