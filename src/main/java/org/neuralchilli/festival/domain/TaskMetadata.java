package org.neuralchilli.festival.domain;

import java.util.List;

/**
 * Metadata declared inside a task file.
 * Every field has a usable default, so a file without metadata still yields a value.
 */
public record TaskMetadata(
        List<String> dependencies,
        List<String> softDependencies,
        Integer parallelGroup,  // null when not overridden
        String autonomyLevel,
        boolean tracked
) {
    public TaskMetadata {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        softDependencies = softDependencies != null ? List.copyOf(softDependencies) : List.of();
    }

    /**
     * Metadata of a file that declares nothing
     */
    public static TaskMetadata empty() {
        return new TaskMetadata(List.of(), List.of(), null, null, true);
    }

    public boolean hasParallelGroupOverride() {
        return parallelGroup != null;
    }
}
