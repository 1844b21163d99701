package org.neuralchilli.festival.domain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency graph of festival tasks.
 * Nodes are keyed by task id; the in-degree and adjacency indexes are kept
 * in step with the edge list as edges are added. Cycles are allowed here and
 * detected by the analyzer.
 *
 * Not thread-safe: populated once by a resolver pass, then read.
 */
public final class DependencyGraph {

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<Path, Task> tasksByPath = new LinkedHashMap<>();
    private final List<Dependency> edges = new ArrayList<>();
    private final Map<String, Integer> inDegree = new LinkedHashMap<>();
    private final Map<String, List<Task>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<Task>> incoming = new LinkedHashMap<>();

    /**
     * Add a task node. A task whose id is already present is ignored.
     *
     * @return true if the task was added
     */
    public boolean addTask(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("Task cannot be null");
        }
        if (tasks.containsKey(task.id())) {
            return false;
        }

        tasks.put(task.id(), task);
        inDegree.put(task.id(), 0);
        outgoing.put(task.id(), new ArrayList<>());
        incoming.put(task.id(), new ArrayList<>());
        if (task.path() != null) {
            tasksByPath.putIfAbsent(normalize(task.path()), task);
        }
        return true;
    }

    /**
     * Add an edge meaning {@code to} requires {@code from}.
     * Both endpoints must already be nodes of this graph.
     */
    public Dependency addDependency(Task from, Task to, DependencyType type, boolean required) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Dependency endpoints cannot be null");
        }
        if (!containsTask(from.id())) {
            throw new IllegalArgumentException("Unknown dependency source: " + from.id());
        }
        if (!containsTask(to.id())) {
            throw new IllegalArgumentException("Unknown dependency target: " + to.id());
        }

        Dependency dependency = new Dependency(from, to, type, required);
        edges.add(dependency);
        inDegree.merge(to.id(), 1, Integer::sum);
        outgoing.get(from.id()).add(to);
        incoming.get(to.id()).add(from);
        return dependency;
    }

    public Optional<Task> getTask(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public Optional<Task> findByPath(Path path) {
        if (path == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasksByPath.get(normalize(path)));
    }

    /**
     * Find a task by id, name, filename stem or filename; first match in insertion order.
     */
    public Optional<Task> findTask(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String q = query.trim();
        if (tasks.containsKey(q)) {
            return Optional.of(tasks.get(q));
        }
        return tasks.values().stream()
                .filter(task -> q.equals(task.name())
                        || q.equals(task.fileStem())
                        || (task.path() != null && q.equals(String.valueOf(task.path().getFileName()))))
                .findFirst();
    }

    public boolean containsTask(String id) {
        return tasks.containsKey(id);
    }

    /**
     * All tasks, in insertion order
     */
    public Collection<Task> tasks() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    /**
     * All edges, in discovery order
     */
    public List<Dependency> edges() {
        return Collections.unmodifiableList(edges);
    }

    public int inDegree(String id) {
        return inDegree.getOrDefault(id, 0);
    }

    /**
     * Direct predecessors: the tasks {@code id} requires
     */
    public List<Task> getDependencies(String id) {
        List<Task> result = incoming.get(id);
        return result != null ? Collections.unmodifiableList(result) : List.of();
    }

    /**
     * Direct successors: the tasks that require {@code id}
     */
    public List<Task> getDependents(String id) {
        List<Task> result = outgoing.get(id);
        return result != null ? Collections.unmodifiableList(result) : List.of();
    }

    /**
     * Tasks of one sequence, in insertion order
     */
    public List<Task> tasksInSequence(String sequencePath) {
        return tasks.values().stream()
                .filter(task -> sequencePath != null && sequencePath.equals(task.sequencePath()))
                .toList();
    }

    /**
     * Distinct sequence ids, in the order their first task was added
     */
    public Set<String> sequencePaths() {
        Set<String> result = new LinkedHashSet<>();
        for (Task task : tasks.values()) {
            if (task.sequencePath() != null) {
                result.add(task.sequencePath());
            }
        }
        return result;
    }

    public int size() {
        return tasks.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    @Override
    public String toString() {
        return "DependencyGraph[tasks=" + tasks.size() + ", edges=" + edges.size() + "]";
    }
}
