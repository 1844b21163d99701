package org.neuralchilli.festival.config;

/**
 * Plain copy of {@link FestivalConfig} so the resolver and extractor can be used
 * without a running container.
 */
public record ResolverSettings(
        String taskExtension,
        String goalMarker,
        String relativePrefix,
        String hardDependenciesField,
        String softDependenciesField,
        String parallelGroupField,
        String autonomyField,
        String trackingField
) {
    public ResolverSettings {
        requireText(taskExtension, "taskExtension");
        requireText(goalMarker, "goalMarker");
        requireText(relativePrefix, "relativePrefix");
        requireText(hardDependenciesField, "hardDependenciesField");
        requireText(softDependenciesField, "softDependenciesField");
        requireText(parallelGroupField, "parallelGroupField");
        requireText(autonomyField, "autonomyField");
        requireText(trackingField, "trackingField");
    }

    /**
     * The conventions festivals are created with
     */
    public static ResolverSettings defaults() {
        return new ResolverSettings(
                ".md",
                "GOAL",
                "..",
                "fest_dependencies",
                "fest_soft_dependencies",
                "fest_parallel_group",
                "fest_autonomy",
                "tracking"
        );
    }

    public static ResolverSettings from(FestivalConfig config) {
        return new ResolverSettings(
                config.taskExtension(),
                config.goalMarker(),
                config.relativePrefix(),
                config.fields().hardDependencies(),
                config.fields().softDependencies(),
                config.fields().parallelGroup(),
                config.fields().autonomy(),
                config.fields().tracking()
        );
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
    }
}
