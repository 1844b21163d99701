package org.neuralchilli.festival.domain;

/**
 * Kinds of problems the validator reports.
 */
public enum IssueCode {
    /**
     * The graph contains a circular dependency
     */
    CYCLE_DETECTED(Severity.ERROR),

    /**
     * A hard reference matches no task
     */
    MISSING_DEPENDENCY(Severity.ERROR),

    /**
     * A soft reference matches no task
     */
    MISSING_SOFT_DEPENDENCY(Severity.WARNING),

    /**
     * A sequence skips a task number; advisory only
     */
    NUMBERING_GAP(Severity.WARNING);

    private final Severity severity;

    IssueCode(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
