package org.neuralchilli.festival.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.NotDirectedAcyclicGraphException;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.festival.domain.Dependency;
import org.neuralchilli.festival.domain.DependencyGraph;
import org.neuralchilli.festival.domain.GraphStatistics;
import org.neuralchilli.festival.domain.Task;
import org.neuralchilli.festival.domain.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Queries over a populated {@link DependencyGraph}: execution order, cycle detection,
 * parallel levels, critical path and ready tasks. Ordering and cycle detection run on a
 * JGraphT projection of the graph.
 *
 * Soft and hard edges are treated the same by every query here. None of the methods
 * modify the graph.
 */
@ApplicationScoped
public class DependencyGraphAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphAnalyzer.class);

    /**
     * Deterministic tie-break for tasks that become eligible together
     */
    public static final Comparator<Task> TASK_ORDER =
            Comparator.comparingInt(Task::number).thenComparing(Task::id);

    /**
     * Order all tasks so that every dependency comes before its dependents.
     * Among simultaneously eligible tasks the lower number, then the lower id, goes first.
     *
     * @return the order, or a cycle that prevents one
     */
    public TopologicalSortResult topologicalSort(DependencyGraph graph) {
        Graph<Task, DefaultEdge> projected = toJGraphT(graph);
        TopologicalOrderIterator<Task, DefaultEdge> iterator =
                new TopologicalOrderIterator<>(projected, TASK_ORDER);

        List<Task> order = new ArrayList<>(graph.size());
        try {
            while (iterator.hasNext()) {
                order.add(iterator.next());
            }
        } catch (NotDirectedAcyclicGraphException e) {
            return cyclic(graph, projected, order.size());
        }

        if (order.size() != graph.size()) {
            return cyclic(graph, projected, order.size());
        }
        return TopologicalSortResult.sorted(order);
    }

    private TopologicalSortResult cyclic(DependencyGraph graph, Graph<Task, DefaultEdge> projected, int ordered) {
        Set<Task> members = new CycleDetector<>(projected).findCycles();
        List<String> cycle = describeCycle(graph, members);
        log.debug("Topological sort stopped with {} of {} tasks ordered; cycle: {}",
                ordered, graph.size(), cycle);
        return TopologicalSortResult.cyclic(cycle);
    }

    /**
     * Check for any cycle, including a task that depends on itself.
     */
    public boolean hasCycle(DependencyGraph graph) {
        for (Dependency edge : graph.edges()) {
            if (edge.from().equals(edge.to())) {
                return true;
            }
        }
        return new CycleDetector<>(toJGraphT(graph)).detectCycles();
    }

    /**
     * Split the graph into execution levels. Level k holds every task whose
     * dependencies all sit in levels below k; tasks in one level may run in parallel.
     * Tasks caught in a cycle never become eligible and are left out.
     */
    public List<List<Task>> parallelGroups(DependencyGraph graph) {
        Map<String, Integer> inDegree = new HashMap<>();
        List<Task> current = new ArrayList<>();

        for (Task task : graph.tasks()) {
            int degree = graph.inDegree(task.id());
            inDegree.put(task.id(), degree);
            if (degree == 0) {
                current.add(task);
            }
        }

        List<List<Task>> levels = new ArrayList<>();
        while (!current.isEmpty()) {
            current.sort(TASK_ORDER);
            levels.add(List.copyOf(current));

            List<Task> next = new ArrayList<>();
            for (Task task : current) {
                for (Task dependent : graph.getDependents(task.id())) {
                    if (inDegree.merge(dependent.id(), -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            current = next;
        }

        log.debug("Graph has {} execution levels", levels.size());
        return levels;
    }

    /**
     * Longest chain of dependent tasks, counted in tasks.
     * Ties go to whichever candidate comes first in topological order.
     *
     * @return the chain from its first to its last task; empty when the graph
     * has no edges or contains a cycle
     */
    public List<Task> criticalPath(DependencyGraph graph) {
        if (graph.edgeCount() == 0) {
            return List.of();
        }

        TopologicalSortResult sort = topologicalSort(graph);
        if (!sort.isSorted()) {
            return List.of();
        }

        List<Task> order = sort.tasks();
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i).id(), i);
        }

        Map<String, Integer> longest = new HashMap<>();
        Map<String, Task> previous = new HashMap<>();

        Task end = null;
        int endLength = 0;

        for (Task task : order) {
            int best = 0;
            Task bestPredecessor = null;

            for (Task predecessor : graph.getDependencies(task.id())) {
                int length = longest.get(predecessor.id());
                if (length > best || (length == best && bestPredecessor != null
                        && position.get(predecessor.id()) < position.get(bestPredecessor.id()))) {
                    best = length;
                    bestPredecessor = predecessor;
                }
            }

            longest.put(task.id(), best + 1);
            if (bestPredecessor != null) {
                previous.put(task.id(), bestPredecessor);
            }

            if (best + 1 > endLength) {
                endLength = best + 1;
                end = task;
            }
        }

        LinkedList<Task> path = new LinkedList<>();
        for (Task cursor = end; cursor != null; cursor = previous.get(cursor.id())) {
            path.addFirst(cursor);
        }
        return List.copyOf(path);
    }

    /**
     * Tasks that can start now: pending, with every direct dependency complete.
     * Reads the current status values on each call.
     */
    public List<Task> readyTasks(DependencyGraph graph) {
        List<Task> ready = new ArrayList<>();

        for (Task task : graph.tasks()) {
            if (task.status() != TaskStatus.PENDING) {
                continue;
            }
            if (allDependenciesComplete(graph, task)) {
                ready.add(task);
            }
        }

        ready.sort(TASK_ORDER);
        log.debug("Found {} ready tasks", ready.size());
        return ready;
    }

    private boolean allDependenciesComplete(DependencyGraph graph, Task task) {
        for (Task dependency : graph.getDependencies(task.id())) {
            if (!dependency.status().isComplete()) {
                return false;
            }
        }
        return true;
    }

    /**
     * All direct and indirect dependencies of a task, nearest first.
     */
    public List<Task> transitiveDependencies(DependencyGraph graph, String taskId) {
        Queue<Task> queue = new ArrayDeque<>(graph.getDependencies(taskId));
        Set<String> visited = new LinkedHashSet<>();
        List<Task> result = new ArrayList<>();

        while (!queue.isEmpty()) {
            Task dependency = queue.poll();
            if (dependency.id().equals(taskId) || !visited.add(dependency.id())) {
                continue;
            }
            result.add(dependency);
            queue.addAll(graph.getDependencies(dependency.id()));
        }

        return result;
    }

    /**
     * Tasks with no dependencies
     */
    public List<Task> rootTasks(DependencyGraph graph) {
        return graph.tasks().stream()
                .filter(task -> graph.inDegree(task.id()) == 0)
                .sorted(TASK_ORDER)
                .toList();
    }

    /**
     * Tasks nothing depends on
     */
    public List<Task> leafTasks(DependencyGraph graph) {
        return graph.tasks().stream()
                .filter(task -> graph.getDependents(task.id()).isEmpty())
                .sorted(TASK_ORDER)
                .toList();
    }

    public GraphStatistics statistics(DependencyGraph graph) {
        List<List<Task>> levels = parallelGroups(graph);
        int maxParallelism = levels.stream()
                .mapToInt(List::size)
                .max()
                .orElse(0);

        return new GraphStatistics(
                graph.size(),
                graph.edgeCount(),
                rootTasks(graph).size(),
                leafTasks(graph).size(),
                levels.size(),
                maxParallelism,
                criticalPath(graph).size()
        );
    }

    /**
     * One concrete cycle through the first cycle member in task order, as ids with the
     * first id repeated at the end. Breadth-first, so the shortest such cycle is chosen.
     */
    private List<String> describeCycle(DependencyGraph graph, Set<Task> members) {
        if (members.isEmpty()) {
            return List.of();
        }
        Task start = members.stream().min(TASK_ORDER).orElseThrow();

        Map<String, Task> parent = new HashMap<>();
        Set<String> seen = new HashSet<>();
        Deque<Task> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start.id());

        while (!queue.isEmpty()) {
            Task current = queue.poll();
            for (Task next : graph.getDependents(current.id())) {
                if (next.equals(start)) {
                    LinkedList<String> cycle = new LinkedList<>();
                    for (Task cursor = current; cursor != null; cursor = parent.get(cursor.id())) {
                        cycle.addFirst(cursor.id());
                    }
                    cycle.addLast(start.id());
                    return List.copyOf(cycle);
                }
                if (members.contains(next) && seen.add(next.id())) {
                    parent.put(next.id(), current);
                    queue.add(next);
                }
            }
        }

        return members.stream().sorted(TASK_ORDER).map(Task::id).toList();
    }

    private static Graph<Task, DefaultEdge> toJGraphT(DependencyGraph graph) {
        Graph<Task, DefaultEdge> projected = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (Task task : graph.tasks()) {
            projected.addVertex(task);
        }
        for (Dependency edge : graph.edges()) {
            // Parallel edges collapse to one; reachability is unchanged
            projected.addEdge(edge.from(), edge.to());
        }
        return projected;
    }
}
