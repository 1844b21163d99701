package org.neuralchilli.festival.domain;

/**
 * A single problem found while validating a festival.
 *
 * @param taskId the task concerned, or null for graph- or sequence-level issues
 */
public record ValidationIssue(
        String taskId,
        IssueCode code,
        String message,
        Severity severity
) {
    public ValidationIssue {
        if (code == null) {
            throw new IllegalArgumentException("Issue code cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Issue message cannot be null or empty");
        }
        if (severity == null) {
            severity = code.severity();
        }
    }

    public static ValidationIssue of(String taskId, IssueCode code, String message) {
        return new ValidationIssue(taskId, code, message, code.severity());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
