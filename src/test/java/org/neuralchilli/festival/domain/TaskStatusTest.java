package org.neuralchilli.festival.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStatusTest {

    @Test
    void shouldExposeWireValues() {
        assertThat(TaskStatus.PENDING.wireValue()).isEqualTo("pending");
        assertThat(TaskStatus.IN_PROGRESS.wireValue()).isEqualTo("in_progress");
        assertThat(TaskStatus.COMPLETE.wireValue()).isEqualTo("complete");
    }

    @Test
    void shouldTreatOnlyCompleteAsComplete() {
        assertThat(TaskStatus.COMPLETE.isComplete()).isTrue();
        assertThat(TaskStatus.IN_PROGRESS.isComplete()).isFalse();
        assertThat(TaskStatus.PENDING.isComplete()).isFalse();
    }
}
