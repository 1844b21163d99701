package org.neuralchilli.festival.domain;

import org.neuralchilli.festival.util.FileNames;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A single file-backed unit of work; the node type of the dependency graph.
 * Everything except {@link #status()} is fixed once the task is built.
 */
public final class Task {

    private final String id;
    private final String name;
    private final int number;
    private final Path path;
    private final String sequencePath;
    private final String phasePath;
    private final int parallelGroup;
    private final List<String> dependencies;
    private final List<String> softDeps;
    private final String autonomyLevel;

    private TaskStatus status;

    public Task(
            String id,
            String name,
            int number,
            Path path,
            String sequencePath,
            String phasePath,
            int parallelGroup,
            TaskStatus status,
            List<String> dependencies,
            List<String> softDeps,
            String autonomyLevel
    ) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (number < 0) {
            throw new IllegalArgumentException("Task number cannot be negative, got: " + number);
        }

        this.id = id;
        this.name = name != null ? name : id;
        this.number = number;
        this.path = path;
        this.sequencePath = sequencePath;
        this.phasePath = phasePath;
        this.parallelGroup = parallelGroup;
        this.status = status != null ? status : TaskStatus.PENDING;
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        this.softDeps = softDeps != null ? List.copyOf(softDeps) : List.of();
        this.autonomyLevel = autonomyLevel;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public int number() {
        return number;
    }

    /**
     * File location, or null for tasks that were not read from disk
     */
    public Path path() {
        return path;
    }

    public String sequencePath() {
        return sequencePath;
    }

    public String phasePath() {
        return phasePath;
    }

    public int parallelGroup() {
        return parallelGroup;
    }

    public TaskStatus status() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    /**
     * Raw hard dependency references, in declaration order
     */
    public List<String> dependencies() {
        return dependencies;
    }

    /**
     * Raw soft dependency references, in declaration order
     */
    public List<String> softDeps() {
        return softDeps;
    }

    public String autonomyLevel() {
        return autonomyLevel;
    }

    /**
     * Filename without extension, e.g. "02_build"; null when the task has no path
     */
    public String fileStem() {
        if (path == null || path.getFileName() == null) {
            return null;
        }
        return FileNames.stripExtension(path.getFileName().toString());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        Task that = (Task) obj;
        // Identity is the id only; status is mutable
        return Objects.equals(this.id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task[id=" + id + ", number=" + number + ", status=" + status.wireValue() + "]";
    }

    /**
     * Builder for creating tasks fluently
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private int number;
        private Path path;
        private String sequencePath;
        private String phasePath;
        private Integer parallelGroup;
        private TaskStatus status = TaskStatus.PENDING;
        private List<String> dependencies = List.of();
        private List<String> softDeps = List.of();
        private String autonomyLevel;

        public Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder number(int number) {
            this.number = number;
            return this;
        }

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder sequencePath(String sequencePath) {
            this.sequencePath = sequencePath;
            return this;
        }

        public Builder phasePath(String phasePath) {
            this.phasePath = phasePath;
            return this;
        }

        public Builder parallelGroup(int parallelGroup) {
            this.parallelGroup = parallelGroup;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder softDeps(List<String> softDeps) {
            this.softDeps = softDeps;
            return this;
        }

        public Builder autonomyLevel(String autonomyLevel) {
            this.autonomyLevel = autonomyLevel;
            return this;
        }

        public Task build() {
            int group = parallelGroup != null ? parallelGroup : number;
            return new Task(id, name, number, path, sequencePath, phasePath, group, status,
                    dependencies, softDeps, autonomyLevel);
        }
    }
}
