package org.neuralchilli.festival.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyTypeTest {

    private static Task task(String id, String phase, String sequence) {
        return Task.builder(id).phasePath(phase).sequencePath(sequence).build();
    }

    @Test
    void shouldClassifySameSequenceAsExplicit() {
        Task a = task("p1/s1/01_a.md", "p1", "p1/s1");
        Task b = task("p1/s1/02_b.md", "p1", "p1/s1");

        assertThat(DependencyType.classify(a, b)).isEqualTo(DependencyType.EXPLICIT);
    }

    @Test
    void shouldClassifyOtherSequenceOfSamePhase() {
        Task a = task("p1/s1/01_a.md", "p1", "p1/s1");
        Task b = task("p1/s2/01_b.md", "p1", "p1/s2");

        assertThat(DependencyType.classify(a, b)).isEqualTo(DependencyType.CROSS_SEQUENCE);
    }

    @Test
    void shouldClassifyOtherPhase() {
        Task a = task("p1/s1/01_a.md", "p1", "p1/s1");
        Task b = task("p2/s1/01_b.md", "p2", "p2/s1");

        assertThat(DependencyType.classify(a, b)).isEqualTo(DependencyType.CROSS_PHASE);
    }

    @Test
    void shouldUseSnakeCaseWireValues() {
        assertThat(DependencyType.CROSS_SEQUENCE.wireValue()).isEqualTo("cross_sequence");
        assertThat(DependencyType.CROSS_PHASE.wireValue()).isEqualTo("cross_phase");
        assertThat(DependencyType.IMPLICIT.wireValue()).isEqualTo("implicit");
    }
}
