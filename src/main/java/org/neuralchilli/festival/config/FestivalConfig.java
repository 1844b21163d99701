package org.neuralchilli.festival.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Naming and metadata conventions the resolver relies on.
 */
@ConfigMapping(prefix = "festival.deps")
public interface FestivalConfig {

    @WithName("task-extension")
    @WithDefault(".md")
    String taskExtension();

    /**
     * Files whose name contains this marker (any case) are goal files, not tasks
     */
    @WithName("goal-marker")
    @WithDefault("GOAL")
    String goalMarker();

    /**
     * References starting with this prefix are resolved relative to the sequence directory
     */
    @WithName("relative-prefix")
    @WithDefault("..")
    String relativePrefix();

    Fields fields();

    /**
     * Frontmatter field names
     */
    interface Fields {

        @WithName("hard-dependencies")
        @WithDefault("fest_dependencies")
        String hardDependencies();

        @WithName("soft-dependencies")
        @WithDefault("fest_soft_dependencies")
        String softDependencies();

        @WithName("parallel-group")
        @WithDefault("fest_parallel_group")
        String parallelGroup();

        @WithDefault("fest_autonomy")
        String autonomy();

        @WithDefault("tracking")
        String tracking();
    }
}
