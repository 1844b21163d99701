package org.neuralchilli.festival.service;

import org.neuralchilli.festival.core.DependencyGraphAnalyzer;
import org.neuralchilli.festival.core.TopologicalSortResult;
import org.neuralchilli.festival.domain.DependencyGraph;
import org.neuralchilli.festival.domain.IssueCode;
import org.neuralchilli.festival.domain.Task;
import org.neuralchilli.festival.domain.ValidationIssue;
import org.neuralchilli.festival.domain.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Checks a festival's dependency graph for cycles, dangling references and
 * numbering gaps. Problems are collected into a {@link ValidationResult}, never thrown.
 */
public class DependencyValidator {

    private static final Logger log = LoggerFactory.getLogger(DependencyValidator.class);

    private final DependencyResolver resolver;
    private final DependencyGraphAnalyzer analyzer;

    public DependencyValidator(DependencyResolver resolver, DependencyGraphAnalyzer analyzer) {
        if (resolver == null || analyzer == null) {
            throw new IllegalArgumentException("Resolver and analyzer are required");
        }
        this.resolver = resolver;
        this.analyzer = analyzer;
    }

    /**
     * Resolve the whole festival and run every check.
     */
    public ValidationResult validate(Path festivalRoot) {
        return validateGraph(resolver.resolveFestival(festivalRoot));
    }

    /**
     * Resolve one sequence and check it for cycles only.
     */
    public ValidationResult validateSequence(Path sequencePath) {
        DependencyGraph graph = resolver.resolveSequence(sequencePath);

        List<ValidationIssue> errors = new ArrayList<>();
        checkCycles(graph, errors);

        ValidationResult result = ValidationResult.of(errors, List.of(), graph);
        logOutcome(sequencePath, result);
        return result;
    }

    /**
     * Run every check against an already resolved graph.
     */
    public ValidationResult validateGraph(DependencyGraph graph) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        checkCycles(graph, errors);
        checkReferences(graph, errors, warnings);
        checkNumberingGaps(graph, warnings);

        ValidationResult result = ValidationResult.of(errors, warnings, graph);
        logOutcome(null, result);
        return result;
    }

    private void checkCycles(DependencyGraph graph, List<ValidationIssue> errors) {
        TopologicalSortResult sort = analyzer.topologicalSort(graph);
        if (sort instanceof TopologicalSortResult.Cyclic cyclic) {
            errors.add(ValidationIssue.of(
                    null,
                    IssueCode.CYCLE_DETECTED,
                    "Circular dependency detected: " + cyclic.cycle()
            ));
        }
    }

    private void checkReferences(
            DependencyGraph graph,
            List<ValidationIssue> errors,
            List<ValidationIssue> warnings
    ) {
        ReferenceResolver references = resolver.referenceResolver();
        List<Task> tasks = graph.tasks().stream()
                .sorted(Comparator.comparing(Task::id))
                .toList();

        for (Task task : tasks) {
            for (String ref : task.dependencies()) {
                if (references.resolve(graph, task, ref).isEmpty()) {
                    errors.add(ValidationIssue.of(
                            task.id(),
                            IssueCode.MISSING_DEPENDENCY,
                            String.format("Task %s declares dependency on \"%s\" which does not exist",
                                    task.name(), ref)
                    ));
                }
            }

            for (String ref : task.softDeps()) {
                if (references.resolve(graph, task, ref).isEmpty()) {
                    warnings.add(ValidationIssue.of(
                            task.id(),
                            IssueCode.MISSING_SOFT_DEPENDENCY,
                            String.format("Task %s declares soft dependency on \"%s\" which does not exist",
                                    task.name(), ref)
                    ));
                }
            }
        }
    }

    /**
     * One warning per contiguous run of numbers missing between 1 and the highest
     * number of a sequence.
     */
    private void checkNumberingGaps(DependencyGraph graph, List<ValidationIssue> warnings) {
        for (String sequencePath : graph.sequencePaths()) {
            TreeSet<Integer> numbers = new TreeSet<>();
            for (Task task : graph.tasksInSequence(sequencePath)) {
                numbers.add(task.number());
            }

            long expected = 1;
            for (int number : numbers) {
                if (number > expected) {
                    warnings.add(gapWarning(sequencePath, expected, number - 1L));
                }
                expected = Math.max(expected, number + 1L);
            }
        }
    }

    private static ValidationIssue gapWarning(String sequencePath, long first, long last) {
        String message = first == last
                ? String.format("Sequence %s has a gap in task numbering at position %d", sequencePath, first)
                : String.format("Sequence %s has a gap in task numbering at positions %d-%d",
                        sequencePath, first, last);
        return ValidationIssue.of(null, IssueCode.NUMBERING_GAP, message);
    }

    private void logOutcome(Path scope, ValidationResult result) {
        String target = scope != null ? scope.toString() : "festival";
        if (result.valid()) {
            log.info("Validated {}: valid ({} warnings)", target, result.warnings().size());
        } else {
            log.warn("Validated {}: {} errors, {} warnings",
                    target, result.errors().size(), result.warnings().size());
            result.errors().forEach(e -> log.debug("  ✗ {}: {}", e.code(), e.message()));
        }
    }
}
