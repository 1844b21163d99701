package org.neuralchilli.festival.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.neuralchilli.festival.core.GraphAnalysis;
import org.neuralchilli.festival.core.TopologicalSortResult;
import org.neuralchilli.festival.domain.Dependency;
import org.neuralchilli.festival.domain.DependencyGraph;
import org.neuralchilli.festival.domain.GraphStatistics;
import org.neuralchilli.festival.domain.Task;
import org.neuralchilli.festival.domain.ValidationIssue;
import org.neuralchilli.festival.domain.ValidationResult;

import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts graphs, analyses and validation results into plain maps and lists
 * (snake_case keys, enum wire values) and writes them as JSON.
 * <p>
 * Tasks are referenced by id everywhere except the top-level task list, so the
 * output stays flat however many edges a task has.
 */
public class GraphJsonSerializer {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public Map<String, Object> write(DependencyGraph graph) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tasks", graph.tasks().stream()
                .sorted(Comparator.comparing(Task::id))
                .map(this::write)
                .toList());
        out.put("edges", graph.edges().stream()
                .map(this::write)
                .toList());
        return out;
    }

    public Map<String, Object> write(Task task) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", task.id());
        out.put("name", task.name());
        out.put("number", task.number());
        putIfPresent(out, "path", task.path() != null ? task.path().toString() : null);
        putIfPresent(out, "sequence_path", task.sequencePath());
        putIfPresent(out, "phase_path", task.phasePath());
        out.put("parallel_group", task.parallelGroup());
        out.put("status", task.status().wireValue());
        out.put("dependencies", task.dependencies());
        out.put("soft_deps", task.softDeps());
        putIfPresent(out, "autonomy_level", task.autonomyLevel());
        return out;
    }

    public Map<String, Object> write(Dependency dependency) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("from", dependency.from().id());
        out.put("to", dependency.to().id());
        out.put("type", dependency.type().wireValue());
        out.put("required", dependency.required());
        return out;
    }

    public Map<String, Object> write(ValidationResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("valid", result.valid());
        out.put("errors", result.errors().stream().map(this::write).toList());
        out.put("warnings", result.warnings().stream().map(this::write).toList());
        if (result.graph() != null) {
            out.put("graph", write(result.graph()));
        }
        return out;
    }

    public Map<String, Object> write(ValidationIssue issue) {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfPresent(out, "task_id", issue.taskId());
        out.put("code", issue.code().name());
        out.put("message", issue.message());
        out.put("severity", issue.severity().wireValue());
        return out;
    }

    public Map<String, Object> write(GraphAnalysis analysis) {
        Map<String, Object> out = new LinkedHashMap<>();
        TopologicalSortResult order = analysis.order();
        if (order instanceof TopologicalSortResult.Cyclic cyclic) {
            out.put("execution_order", List.of());
            out.put("cycle", cyclic.cycle());
        } else {
            out.put("execution_order", ids(order.tasks()));
        }
        out.put("parallel_groups", analysis.parallelGroups().stream()
                .map(GraphJsonSerializer::ids)
                .toList());
        out.put("critical_path", ids(analysis.criticalPath()));
        out.put("ready", ids(analysis.readyTasks()));
        if (analysis.statistics() != null) {
            out.put("statistics", write(analysis.statistics()));
        }
        return out;
    }

    public Map<String, Object> write(GraphStatistics statistics) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("total_tasks", statistics.totalTasks());
        out.put("total_edges", statistics.totalEdges());
        out.put("root_tasks", statistics.rootTasks());
        out.put("leaf_tasks", statistics.leafTasks());
        out.put("execution_levels", statistics.executionLevels());
        out.put("max_parallelism", statistics.maxParallelism());
        out.put("critical_path_length", statistics.criticalPathLength());
        return out;
    }

    /**
     * Pretty-printed JSON of a structure built by one of the {@code write} methods
     */
    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize dependency data", e);
        }
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    private static void putIfPresent(Map<String, Object> out, String key, Object value) {
        if (value != null) {
            out.put(key, value);
        }
    }
}
