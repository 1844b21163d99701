package org.neuralchilli.festival.core;

import org.neuralchilli.festival.domain.Task;

import java.util.List;

/**
 * Result of ordering a dependency graph.
 * Either every task in dependency order, or the cycle that made ordering impossible.
 */
public sealed interface TopologicalSortResult {

    boolean isSorted();

    /**
     * Ordered tasks, or an empty list if a cycle was found
     */
    List<Task> tasks();

    /**
     * Ordered tasks, or throw if a cycle was found
     *
     * @throws CycleDetectedException if the graph is cyclic
     */
    List<Task> orElseThrow();

    /**
     * Every task, dependencies first
     */
    record Sorted(List<Task> tasks) implements TopologicalSortResult {
        public Sorted {
            tasks = List.copyOf(tasks);
        }

        @Override
        public boolean isSorted() {
            return true;
        }

        @Override
        public List<Task> orElseThrow() {
            return tasks;
        }
    }

    /**
     * Ordering failed; {@code cycle} lists task ids on one cycle
     */
    record Cyclic(List<String> cycle) implements TopologicalSortResult {
        public Cyclic {
            cycle = cycle != null ? List.copyOf(cycle) : List.of();
        }

        @Override
        public boolean isSorted() {
            return false;
        }

        @Override
        public List<Task> tasks() {
            return List.of();
        }

        @Override
        public List<Task> orElseThrow() {
            throw new CycleDetectedException(cycle);
        }

        public String message() {
            return CycleDetectedException.describe(cycle);
        }
    }

    static TopologicalSortResult sorted(List<Task> tasks) {
        return new Sorted(tasks);
    }

    static TopologicalSortResult cyclic(List<String> cycle) {
        return new Cyclic(cycle);
    }
}
