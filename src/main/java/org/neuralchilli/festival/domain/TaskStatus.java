package org.neuralchilli.festival.domain;

/**
 * Progress status of a festival task.
 * Set by the progress-tracking side; read by the ready-task query.
 */
public enum TaskStatus {
    /**
     * Not started
     */
    PENDING("pending"),

    /**
     * Someone is working on it
     */
    IN_PROGRESS("in_progress"),

    /**
     * Done
     */
    COMPLETE("complete");

    private final String wireValue;

    TaskStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Value used in frontmatter and JSON output
     */
    public String wireValue() {
        return wireValue;
    }

    public boolean isComplete() {
        return this == COMPLETE;
    }
}
