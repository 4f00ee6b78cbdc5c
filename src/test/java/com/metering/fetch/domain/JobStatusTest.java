package com.metering.fetch.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobStatus Tests")
class JobStatusTest {

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    @DisplayName("Terminal statuses should have no outgoing transitions")
    void testTerminalStatuses(JobStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (JobStatus target : JobStatus.values()) {
            assertThat(terminal.canTransitionTo(target)).as("%s -> %s", terminal, target).isFalse();
        }
    }

    @Test
    @DisplayName("Should follow the job lifecycle graph")
    void testAllowedTransitions() {
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.PROCESSING)).isTrue();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.CANCELLED)).isTrue();
        assertThat(JobStatus.PROCESSING.canTransitionTo(JobStatus.COMPLETED)).isTrue();
        assertThat(JobStatus.PROCESSING.canTransitionTo(JobStatus.RETRYING)).isTrue();
        assertThat(JobStatus.PROCESSING.canTransitionTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.RETRYING.canTransitionTo(JobStatus.PROCESSING)).isTrue();
    }

    @Test
    @DisplayName("Should never fail a job that was not processing")
    void testNoQueuedToFailed() {
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.FAILED)).isFalse();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.COMPLETED)).isFalse();
        assertThat(JobStatus.sourcesOf(JobStatus.FAILED)).containsExactly(JobStatus.PROCESSING);
    }
}
