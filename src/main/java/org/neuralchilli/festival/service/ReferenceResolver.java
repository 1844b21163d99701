package org.neuralchilli.festival.service;

import org.neuralchilli.festival.config.ResolverSettings;
import org.neuralchilli.festival.domain.DependencyGraph;
import org.neuralchilli.festival.domain.Task;
import org.neuralchilli.festival.util.FileNames;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves a declared dependency reference to a task of a graph.
 *
 * Supported forms:
 * <ul>
 *   <li>{@code build} or {@code 02_build.md}: a task of the same sequence, by name or filename</li>
 *   <li>{@code ../02_other/01_task}: relative to the sequence directory (cross-sequence)</li>
 *   <li>{@code ../../002_PHASE/01_seq/01_task.md}: relative, across phases</li>
 * </ul>
 * Looks only at the graph passed in; no filesystem access.
 */
public class ReferenceResolver {

    private final ResolverSettings settings;

    public ReferenceResolver(ResolverSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Resolver settings cannot be null");
        }
        this.settings = settings;
    }

    /**
     * @param graph     graph holding every candidate task
     * @param from      task that declares the reference
     * @param reference raw reference string
     * @return the referenced task, or empty if nothing matches
     */
    public Optional<Task> resolve(DependencyGraph graph, Task from, String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String ref = reference.trim();

        if (ref.startsWith(settings.relativePrefix())) {
            return sequenceDirectory(from).flatMap(dir -> lookup(graph, dir, ref));
        }

        String stripped = FileNames.stripSuffix(ref, settings.taskExtension());
        for (Task candidate : graph.tasksInSequence(from.sequencePath())) {
            if (matches(candidate, ref, stripped)) {
                return Optional.of(candidate);
            }
        }

        return sequenceDirectory(from).flatMap(dir -> lookup(graph, dir, ref));
    }

    private static boolean matches(Task candidate, String ref, String stripped) {
        return ref.equals(candidate.name())
                || stripped.equals(candidate.name())
                || ref.equals(candidate.fileStem())
                || stripped.equals(candidate.fileStem());
    }

    private Optional<Task> lookup(DependencyGraph graph, Path sequenceDirectory, String ref) {
        try {
            Path target = sequenceDirectory.resolve(ref).normalize();
            Path fileName = target.getFileName();
            if (fileName == null) {
                return Optional.empty();
            }
            if (!fileName.toString().endsWith(settings.taskExtension())) {
                target = target.resolveSibling(fileName + settings.taskExtension());
            }
            return graph.findByPath(target);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static Optional<Path> sequenceDirectory(Task task) {
        if (task.path() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(task.path().getParent());
    }
}
