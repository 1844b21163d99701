package org.neuralchilli.festival.domain;

/**
 * Directed edge {@code from -> to}: {@code to} requires {@code from}.
 * Soft edges ({@code required == false}) are traversed exactly like hard ones.
 */
public record Dependency(
        Task from,
        Task to,
        DependencyType type,
        boolean required
) {
    public Dependency {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Dependency endpoints cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("Dependency type cannot be null");
        }
    }

    @Override
    public String toString() {
        return String.format("%s -> %s (%s%s)",
                from.id(), to.id(), type.wireValue(), required ? "" : ", soft");
    }
}
