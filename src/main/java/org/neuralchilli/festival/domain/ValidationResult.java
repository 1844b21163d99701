package org.neuralchilli.festival.domain;

import java.util.List;

/**
 * Outcome of validating a festival or a sequence.
 * The result is valid when there are no errors; warnings never affect validity.
 */
public record ValidationResult(
        boolean valid,
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings,
        DependencyGraph graph
) {
    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("A result with errors cannot be valid");
        }
    }

    public static ValidationResult of(
            List<ValidationIssue> errors,
            List<ValidationIssue> warnings,
            DependencyGraph graph
    ) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors, warnings, graph);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Check whether an issue with the given code was reported, as error or warning
     */
    public boolean hasIssue(IssueCode code) {
        return errors.stream().anyMatch(i -> i.code() == code)
                || warnings.stream().anyMatch(i -> i.code() == code);
    }
}
