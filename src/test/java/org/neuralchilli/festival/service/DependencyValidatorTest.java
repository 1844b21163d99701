package org.neuralchilli.festival.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.festival.FestivalFixture;
import org.neuralchilli.festival.config.ResolverSettings;
import org.neuralchilli.festival.core.DependencyGraphAnalyzer;
import org.neuralchilli.festival.domain.DependencyGraph;
import org.neuralchilli.festival.domain.DependencyType;
import org.neuralchilli.festival.domain.IssueCode;
import org.neuralchilli.festival.domain.Severity;
import org.neuralchilli.festival.domain.Task;
import org.neuralchilli.festival.domain.ValidationIssue;
import org.neuralchilli.festival.domain.ValidationResult;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DependencyValidatorTest {

    private static final String PLAN = "001_PLAN";
    private static final String SETUP = "01_setup";

    @TempDir
    Path tempDir;

    private FestivalFixture festival;
    private DependencyGraphAnalyzer analyzer;
    private DependencyValidator validator;

    @BeforeEach
    void setup() {
        festival = FestivalFixture.in(tempDir);
        analyzer = new DependencyGraphAnalyzer();
        validator = new DependencyValidator(new DependencyResolver(ResolverSettings.defaults()), analyzer);
    }

    @Test
    void shouldAcceptCleanFestival() {
        festival.task(PLAN, SETUP, "01_a.md");
        festival.task(PLAN, SETUP, "02_b.md", FestivalFixture.withFrontmatter("fest_dependencies: [a]\n"));

        ValidationResult result = validator.validate(festival.root());

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.graph().size()).isEqualTo(2);
    }

    @Test
    void shouldReportMissingHardDependencyAsError() {
        festival.task(PLAN, SETUP, "01_a.md", FestivalFixture.withFrontmatter("fest_dependencies: [ghost]\n"));

        ValidationResult result = validator.validate(festival.root());

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.MISSING_DEPENDENCY);
            assertThat(issue.severity()).isEqualTo(Severity.ERROR);
            assertThat(issue.taskId()).isEqualTo(PLAN + "/" + SETUP + "/01_a.md");
            assertThat(issue.message()).isEqualTo("Task a declares dependency on \"ghost\" which does not exist");
        });
    }

    @Test
    void shouldReportMissingSoftDependencyAsWarningOnly() {
        festival.task(PLAN, SETUP, "01_a.md", FestivalFixture.withFrontmatter("fest_soft_dependencies: [docs]\n"));

        ValidationResult result = validator.validate(festival.root());

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).extracting(ValidationIssue::code)
                .containsExactly(IssueCode.MISSING_SOFT_DEPENDENCY);
        assertThat(result.warnings().get(0).message()).contains("soft dependency on \"docs\"");
    }

    @Test
    void shouldWarnOncePerNumberingGap() {
        // Given: 02 and 03 missing as one run, 05 missing on its own
        festival.task(PLAN, SETUP, "01_a.md");
        festival.task(PLAN, SETUP, "04_d.md");
        festival.task(PLAN, SETUP, "06_f.md");

        ValidationResult result = validator.validate(festival.root());

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).extracting(ValidationIssue::message).containsExactly(
                "Sequence 001_PLAN/01_setup has a gap in task numbering at positions 2-3",
                "Sequence 001_PLAN/01_setup has a gap in task numbering at position 5"
        );
        assertThat(result.warnings()).allMatch(issue -> issue.taskId() == null);

        // A gap never blocks ordering
        assertThat(analyzer.topologicalSort(result.graph()).isSorted()).isTrue();
    }

    @Test
    void shouldReportWideNumberingGapAsSingleWarning() {
        festival.task(PLAN, SETUP, "01_a.md");
        festival.task(PLAN, SETUP, "2000000_b.md");

        ValidationResult result = validator.validate(festival.root());

        assertThat(result.warnings()).extracting(ValidationIssue::message).containsExactly(
                "Sequence 001_PLAN/01_setup has a gap in task numbering at positions 2-1999999");
        assertThat(result.graph().size()).isEqualTo(2);
    }

    @Test
    void shouldNotCountNumberZeroAsGap() {
        festival.task(PLAN, SETUP, "00_intro.md");
        festival.task(PLAN, SETUP, "01_a.md");

        assertThat(validator.validate(festival.root()).warnings()).isEmpty();
    }

    @Test
    void shouldReportCycleFromDeclaredReferences() {
        // Given: b follows a by number, but a declares it needs b
        festival.task(PLAN, SETUP, "01_a.md", FestivalFixture.withFrontmatter("fest_dependencies: [b]\n"));
        festival.task(PLAN, SETUP, "02_b.md");

        ValidationResult result = validator.validate(festival.root());

        assertThat(result.valid()).isFalse();
        assertThat(result.hasIssue(IssueCode.CYCLE_DETECTED)).isTrue();
        assertThat(result.errors().get(0).message())
                .startsWith("Circular dependency detected: ")
                .contains("001_PLAN/01_setup/01_a.md", "001_PLAN/01_setup/02_b.md");
        assertThat(result.errors().get(0).taskId()).isNull();
    }

    @Test
    void shouldListCycleBeforeTaskIssues() {
        DependencyGraph graph = new DependencyGraph();
        Task a = Task.builder("a").number(1).sequencePath("s").dependencies(List.of("ghost")).build();
        Task b = Task.builder("b").number(2).sequencePath("s").build();
        graph.addTask(a);
        graph.addTask(b);
        graph.addDependency(a, b, DependencyType.IMPLICIT, true);
        graph.addDependency(b, a, DependencyType.EXPLICIT, true);

        ValidationResult result = validator.validateGraph(graph);

        assertThat(result.errors()).extracting(ValidationIssue::code)
                .containsExactly(IssueCode.CYCLE_DETECTED, IssueCode.MISSING_DEPENDENCY);
    }

    @Test
    void shouldCollectCycleErrorWhenLongChainFollowsCycle() {
        DependencyGraph graph = new DependencyGraph();
        Task x = Task.builder("x").number(1).sequencePath("s").build();
        Task y = Task.builder("y").number(2).sequencePath("s").build();
        graph.addTask(x);
        graph.addTask(y);
        graph.addDependency(x, y, DependencyType.EXPLICIT, true);
        graph.addDependency(y, x, DependencyType.EXPLICIT, true);
        Task previous = y;
        for (int i = 0; i < 10_000; i++) {
            Task next = Task.builder(String.format("c%05d", i)).number(3).sequencePath("chain").build();
            graph.addTask(next);
            graph.addDependency(previous, next, DependencyType.CROSS_SEQUENCE, true);
            previous = next;
        }

        ValidationResult result = validator.validateGraph(graph);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(ValidationIssue::message)
                .containsExactly("Circular dependency detected: [x, y, x]");
    }

    @Test
    void shouldValidateSequenceForCyclesOnly() {
        festival.task(PLAN, SETUP, "01_a.md", FestivalFixture.withFrontmatter("fest_dependencies: [ghost]\n"));
        festival.task(PLAN, SETUP, "03_c.md");
        Path sequence = festival.sequence(PLAN, SETUP);

        ValidationResult result = validator.validateSequence(sequence);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.graph().size()).isEqualTo(2);
    }

    @Test
    void shouldReportCycleInSequence() {
        festival.task(PLAN, SETUP, "01_a.md", FestivalFixture.withFrontmatter("fest_dependencies: [b]\n"));
        festival.task(PLAN, SETUP, "02_b.md");

        ValidationResult result = validator.validateSequence(festival.sequence(PLAN, SETUP));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(ValidationIssue::code).containsExactly(IssueCode.CYCLE_DETECTED);
    }

    @Test
    void shouldTreatEmptyFestivalAsValid() {
        ValidationResult result = validator.validate(festival.root());

        assertThat(result.valid()).isTrue();
        assertThat(result.graph().isEmpty()).isTrue();
    }

    @Test
    void shouldRequireCollaborators() {
        assertThatThrownBy(() -> new DependencyValidator(null, analyzer))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
