package org.neuralchilli.festival.service;

import org.neuralchilli.festival.config.ResolverSettings;
import org.neuralchilli.festival.config.TaskMetadataExtractor;
import org.neuralchilli.festival.domain.DependencyGraph;
import org.neuralchilli.festival.domain.DependencyType;
import org.neuralchilli.festival.domain.Task;
import org.neuralchilli.festival.domain.TaskMetadata;
import org.neuralchilli.festival.domain.TaskStatus;
import org.neuralchilli.festival.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Builds a {@link DependencyGraph} from a festival directory tree.
 *
 * Layout: festival root / {@code NNN_PHASE} / {@code NN_sequence} / {@code NN_task.md}.
 * Tasks of one sequence are chained by number (implicit edges); declared references
 * add explicit edges once every task of the scope is known.
 *
 * Each call returns a new graph. Unreadable directories and files are skipped.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final ResolverSettings settings;
    private final TaskMetadataExtractor extractor;
    private final ReferenceResolver referenceResolver;

    public DependencyResolver(ResolverSettings settings) {
        this(settings, new TaskMetadataExtractor(settings), new ReferenceResolver(settings));
    }

    public DependencyResolver(
            ResolverSettings settings,
            TaskMetadataExtractor extractor,
            ReferenceResolver referenceResolver
    ) {
        if (settings == null) {
            throw new IllegalArgumentException("Resolver settings cannot be null");
        }
        this.settings = settings;
        this.extractor = extractor;
        this.referenceResolver = referenceResolver;
    }

    public ReferenceResolver referenceResolver() {
        return referenceResolver;
    }

    /**
     * Build the graph of every tracked task in the festival.
     */
    public DependencyGraph resolveFestival(Path festivalRoot) {
        return resolveFestival(festivalRoot, NEVER_CANCELLED);
    }

    /**
     * Build the graph of every tracked task in the festival, checking the
     * cancellation signal before each phase and each sequence.
     *
     * @throws ResolutionCancelledException if {@code cancelled} reports true
     */
    public DependencyGraph resolveFestival(Path festivalRoot, BooleanSupplier cancelled) {
        if (festivalRoot == null) {
            throw new IllegalArgumentException("Festival root cannot be null");
        }
        Path root = festivalRoot.toAbsolutePath().normalize();
        DependencyGraph graph = new DependencyGraph();

        log.debug("Resolving festival: {}", root);

        for (Path phaseDir : listNumberedDirectories(root)) {
            checkCancelled(cancelled, phaseDir);

            for (Path sequenceDir : listNumberedDirectories(phaseDir)) {
                checkCancelled(cancelled, sequenceDir);

                List<Task> tasks = loadSequenceTasks(root, phaseDir, sequenceDir);
                tasks.forEach(graph::addTask);
                addImplicitDependencies(graph, tasks);
            }
        }

        addExplicitDependencies(graph);

        log.info("Resolved festival {}: {} tasks, {} dependencies",
                root.getFileName(), graph.size(), graph.edgeCount());
        return graph;
    }

    /**
     * Build the graph of one sequence. The festival root is taken to be the
     * sequence's grandparent, so ids match those of a full festival pass.
     */
    public DependencyGraph resolveSequence(Path sequencePath) {
        return resolveSequence(sequencePath, NEVER_CANCELLED);
    }

    /**
     * @throws ResolutionCancelledException if {@code cancelled} reports true
     */
    public DependencyGraph resolveSequence(Path sequencePath, BooleanSupplier cancelled) {
        if (sequencePath == null) {
            throw new IllegalArgumentException("Sequence path cannot be null");
        }
        Path sequenceDir = sequencePath.toAbsolutePath().normalize();
        if (!Files.isDirectory(sequenceDir)) {
            throw new IllegalArgumentException("Sequence path is not a directory: " + sequencePath);
        }

        Path phaseDir = Optional.ofNullable(sequenceDir.getParent()).orElse(sequenceDir);
        Path root = Optional.ofNullable(phaseDir.getParent()).orElse(phaseDir);

        checkCancelled(cancelled, sequenceDir);

        DependencyGraph graph = new DependencyGraph();
        List<Task> tasks = loadSequenceTasks(root, phaseDir, sequenceDir);
        tasks.forEach(graph::addTask);
        addImplicitDependencies(graph, tasks);
        addExplicitDependencies(graph);

        log.info("Resolved sequence {}: {} tasks, {} dependencies",
                sequenceDir.getFileName(), graph.size(), graph.edgeCount());
        return graph;
    }

    /**
     * Numbered subdirectories, sorted by name. Zero-padded prefixes make this numeric order.
     */
    List<Path> listNumberedDirectories(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(p -> FileNames.isNumberedDirectory(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Skipping unreadable directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    /**
     * Load the tracked task files of one sequence, ordered by number then id.
     */
    List<Task> loadSequenceTasks(Path root, Path phaseDir, Path sequenceDir) {
        List<Path> files;
        try (Stream<Path> entries = Files.list(sequenceDir)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> isTaskFileName(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Skipping unreadable sequence {}: {}", sequenceDir, e.getMessage());
            return List.of();
        }

        String phaseId = relativeId(root, phaseDir);
        String sequenceId = relativeId(root, sequenceDir);

        List<Task> tasks = new ArrayList<>();
        for (Path file : files) {
            TaskMetadata metadata = readMetadata(file);
            if (!metadata.tracked()) {
                log.debug("Skipping untracked task file: {}", file);
                continue;
            }

            String fileName = file.getFileName().toString();
            int number = FileNames.leadingNumber(fileName);

            Task task = Task.builder(relativeId(root, file))
                    .name(FileNames.displayName(fileName))
                    .number(number)
                    .path(file)
                    .sequencePath(sequenceId)
                    .phasePath(phaseId)
                    .parallelGroup(metadata.hasParallelGroupOverride() ? metadata.parallelGroup() : number)
                    .status(TaskStatus.PENDING)
                    .dependencies(metadata.dependencies())
                    .softDeps(metadata.softDependencies())
                    .autonomyLevel(metadata.autonomyLevel())
                    .build();

            log.trace("Loaded task {} (number {})", task.id(), number);
            tasks.add(task);
        }

        tasks.sort(Comparator.comparingInt(Task::number).thenComparing(Task::id));
        return tasks;
    }

    boolean isTaskFileName(String fileName) {
        if (!fileName.endsWith(settings.taskExtension())) {
            return false;
        }
        if (fileName.toUpperCase(Locale.ROOT).contains(settings.goalMarker().toUpperCase(Locale.ROOT))) {
            return false;
        }
        return FileNames.leadingNumber(fileName) >= 0;
    }

    private TaskMetadata readMetadata(Path file) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            log.warn("Could not read task file {}, using default metadata: {}", file, e.getMessage());
            return TaskMetadata.empty();
        }
        return extractor.extract(file, content);
    }

    /**
     * Every task at one present number depends on every task at the previous present
     * number. Tasks sharing a number are not ordered among themselves.
     */
    void addImplicitDependencies(DependencyGraph graph, List<Task> tasks) {
        Map<Integer, List<Task>> byNumber = new TreeMap<>();
        for (Task task : tasks) {
            byNumber.computeIfAbsent(task.number(), n -> new ArrayList<>()).add(task);
        }

        List<Task> previous = null;
        for (List<Task> current : byNumber.values()) {
            if (previous != null) {
                for (Task currentTask : current) {
                    for (Task previousTask : previous) {
                        graph.addDependency(previousTask, currentTask, DependencyType.IMPLICIT, true);
                    }
                }
            }
            previous = current;
        }
    }

    /**
     * Turn each resolvable declared reference into an edge; unresolvable ones are
     * left for the validator to report.
     */
    void addExplicitDependencies(DependencyGraph graph) {
        List<Task> tasks = graph.tasks().stream()
                .sorted(Comparator.comparing(Task::id))
                .toList();

        for (Task task : tasks) {
            addDeclared(graph, task, task.dependencies(), true);
            addDeclared(graph, task, task.softDeps(), false);
        }
    }

    private void addDeclared(DependencyGraph graph, Task task, List<String> references, boolean required) {
        for (String reference : references) {
            Optional<Task> dependency = referenceResolver.resolve(graph, task, reference);
            if (dependency.isEmpty()) {
                log.debug("Unresolved {} reference '{}' in {}", required ? "hard" : "soft", reference, task.id());
                continue;
            }
            Task from = dependency.get();
            graph.addDependency(from, task, DependencyType.classify(from, task), required);
        }
    }

    private static void checkCancelled(BooleanSupplier cancelled, Path next) {
        if (cancelled != null && cancelled.getAsBoolean()) {
            throw new ResolutionCancelledException("Resolution cancelled before " + next.getFileName());
        }
    }

    /**
     * Path relative to the festival root with '/' separators; the root itself maps to "."
     */
    static String relativeId(Path root, Path path) {
        Path relative = root.relativize(path.toAbsolutePath().normalize());
        String id = relative.toString().replace(relative.getFileSystem().getSeparator(), "/");
        return id.isEmpty() ? "." : id;
    }
}
