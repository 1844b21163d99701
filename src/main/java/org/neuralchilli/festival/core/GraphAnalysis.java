package org.neuralchilli.festival.core;

import org.neuralchilli.festival.domain.DependencyGraph;
import org.neuralchilli.festival.domain.GraphStatistics;
import org.neuralchilli.festival.domain.Task;

import java.util.List;

/**
 * Every derived view of one graph, computed together for display or export.
 */
public record GraphAnalysis(
        DependencyGraph graph,
        TopologicalSortResult order,
        List<List<Task>> parallelGroups,
        List<Task> criticalPath,
        List<Task> readyTasks,
        GraphStatistics statistics
) {
    public GraphAnalysis {
        if (graph == null || order == null) {
            throw new IllegalArgumentException("Graph and order are required");
        }
        parallelGroups = parallelGroups != null ? List.copyOf(parallelGroups) : List.of();
        criticalPath = criticalPath != null ? List.copyOf(criticalPath) : List.of();
        readyTasks = readyTasks != null ? List.copyOf(readyTasks) : List.of();
    }
}
