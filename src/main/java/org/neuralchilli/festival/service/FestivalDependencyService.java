package org.neuralchilli.festival.service;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.festival.config.FestivalConfig;
import org.neuralchilli.festival.config.ResolverSettings;
import org.neuralchilli.festival.core.DependencyGraphAnalyzer;
import org.neuralchilli.festival.core.GraphAnalysis;
import org.neuralchilli.festival.domain.DependencyGraph;
import org.neuralchilli.festival.domain.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.function.BooleanSupplier;

/**
 * Entry point for consumers: resolves festivals and sequences into dependency
 * graphs, validates them, and computes the derived views.
 */
@ApplicationScoped
public class FestivalDependencyService {

    private static final Logger log = LoggerFactory.getLogger(FestivalDependencyService.class);

    @Inject
    FestivalConfig config;

    @Inject
    DependencyGraphAnalyzer analyzer;

    private DependencyResolver resolver;
    private DependencyValidator validator;

    @PostConstruct
    void init() {
        ResolverSettings settings = ResolverSettings.from(config);
        resolver = new DependencyResolver(settings);
        validator = new DependencyValidator(resolver, analyzer);

        log.debug("Festival dependency service ready (task extension {}, goal marker {})",
                settings.taskExtension(), settings.goalMarker());
    }

    public DependencyGraph resolveFestival(Path festivalRoot) {
        return resolver.resolveFestival(festivalRoot);
    }

    public DependencyGraph resolveFestival(Path festivalRoot, BooleanSupplier cancelled) {
        return resolver.resolveFestival(festivalRoot, cancelled);
    }

    public DependencyGraph resolveSequence(Path sequencePath) {
        return resolver.resolveSequence(sequencePath);
    }

    public DependencyGraph resolveSequence(Path sequencePath, BooleanSupplier cancelled) {
        return resolver.resolveSequence(sequencePath, cancelled);
    }

    public ValidationResult validate(Path festivalRoot) {
        return validator.validate(festivalRoot);
    }

    public ValidationResult validateSequence(Path sequencePath) {
        return validator.validateSequence(sequencePath);
    }

    /**
     * Compute every derived view of a resolved graph.
     */
    public GraphAnalysis analyze(DependencyGraph graph) {
        return new GraphAnalysis(
                graph,
                analyzer.topologicalSort(graph),
                analyzer.parallelGroups(graph),
                analyzer.criticalPath(graph),
                analyzer.readyTasks(graph),
                analyzer.statistics(graph)
        );
    }
}
