package org.neuralchilli.festival.core;

import java.util.List;

/**
 * Thrown when an execution order is demanded from a graph that contains a cycle.
 * Carries the ids of the tasks on the cycle, first and last entry identical.
 */
public class CycleDetectedException extends RuntimeException {

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        this(describe(cycle), cycle);
    }

    public CycleDetectedException(String message, List<String> cycle) {
        super(message);
        this.cycle = cycle != null ? List.copyOf(cycle) : List.of();
    }

    public List<String> cycle() {
        return cycle;
    }

    /**
     * "circular dependency: a -> ... -> a", or a generic message when no members are known
     */
    public static String describe(List<String> cycle) {
        if (cycle == null || cycle.isEmpty()) {
            return "circular dependency detected";
        }
        return "circular dependency: " + cycle.get(0) + " -> ... -> " + cycle.get(cycle.size() - 1);
    }
}
