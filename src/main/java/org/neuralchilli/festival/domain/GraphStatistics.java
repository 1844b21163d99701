package org.neuralchilli.festival.domain;

import javax.annotation.Nonnull;

/**
 * Shape of a dependency graph: size, width and depth.
 */
public record GraphStatistics(
        int totalTasks,
        int totalEdges,
        int rootTasks,
        int leafTasks,
        int executionLevels,
        int maxParallelism,
        int criticalPathLength
) {
    public GraphStatistics {
        if (totalTasks < 0) {
            throw new IllegalArgumentException("Total tasks cannot be negative");
        }
        if (totalEdges < 0) {
            throw new IllegalArgumentException("Total edges cannot be negative");
        }
        if (rootTasks < 0 || leafTasks < 0) {
            throw new IllegalArgumentException("Root and leaf counts cannot be negative");
        }
        if (executionLevels < 0) {
            throw new IllegalArgumentException("Execution levels cannot be negative");
        }
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("Max parallelism cannot be negative");
        }
        if (criticalPathLength < 0) {
            throw new IllegalArgumentException("Critical path length cannot be negative");
        }
    }

    /**
     * Check if at least two tasks can ever run side by side
     */
    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    /**
     * Number of sequential execution levels
     */
    public int depth() {
        return executionLevels;
    }

    /**
     * Widest execution level
     */
    public int width() {
        return maxParallelism;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "GraphStatistics[tasks=%d, edges=%d, levels=%d, max_parallel=%d, critical_path=%d, roots=%d, leaves=%d]",
                totalTasks, totalEdges, executionLevels, maxParallelism, criticalPathLength, rootTasks, leafTasks
        );
    }
}
