package com.metering.fetch.jobs;

import com.metering.fetch.analytics.RequestAnalyticsRecorder;
import com.metering.fetch.cache.ObjectCacheStore;
import com.metering.fetch.config.FetchProperties;
import com.metering.fetch.domain.JobStatus;
import com.metering.fetch.exception.CacheException;
import com.metering.fetch.storage.jpa.JobHistoryEntity;
import com.metering.fetch.storage.jpa.JobHistoryJpaRepository;
import com.metering.fetch.storage.jpa.QueueJobEntity;
import com.metering.fetch.storage.jpa.QueueJobJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("JobHousekeeping Tests")
class JobHousekeepingTest {

    private static final Instant NOW = Instant.parse("2025-03-10T00:00:00Z");

    private QueueJobJpaRepository jobs;
    private JobHistoryJpaRepository history;
    private ObjectCacheStore cache;
    private RequestAnalyticsRecorder analytics;
    private JobHousekeeping housekeeping;

    @BeforeEach
    void setUp() {
        jobs = mock(QueueJobJpaRepository.class);
        history = mock(JobHistoryJpaRepository.class);
        cache = mock(ObjectCacheStore.class);
        analytics = mock(RequestAnalyticsRecorder.class);
        housekeeping = new JobHousekeeping(jobs, history, cache, analytics, new FetchProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should archive terminal jobs older than the retention window")
    void testArchive() {
        QueueJobEntity failed = QueueJobEntity.builder()
            .jobId("job_old")
            .site("site-1")
            .points(List.of("p1", "p2"))
            .status(JobStatus.FAILED)
            .errorMessage("Upstream returned 503")
            .processingTimeMs(1200L)
            .createdAt(NOW.minus(Duration.ofDays(8)))
            .failedAt(NOW.minus(Duration.ofDays(8)).plusSeconds(5))
            .build();
        when(jobs.findByStatusInAndCreatedAtBefore(JobStatus.TERMINAL, NOW.minus(Duration.ofDays(7))))
            .thenReturn(List.of(failed));

        assertThat(housekeeping.archiveTerminalJobs()).isEqualTo(1);

        ArgumentCaptor<JobHistoryEntity> captor = ArgumentCaptor.forClass(JobHistoryEntity.class);
        verify(history).save(captor.capture());
        JobHistoryEntity archived = captor.getValue();
        assertThat(archived.getJobId()).isEqualTo("job_old");
        assertThat(archived.getPointsCount()).isEqualTo(2);
        assertThat(archived.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(archived.getDurationMs()).isEqualTo(1200L);
        assertThat(archived.getCompletedAt()).isEqualTo(failed.getFailedAt());
        assertThat(archived.getArchivedAt()).isEqualTo(NOW);
        verify(jobs).deleteAll(List.of(failed));
    }

    @Test
    @DisplayName("Should do nothing when no job is old enough")
    void testArchiveNothing() {
        when(jobs.findByStatusInAndCreatedAtBefore(any(), any())).thenReturn(List.of());

        assertThat(housekeeping.archiveTerminalJobs()).isZero();
        verify(history, never()).save(any());
    }

    @Test
    @DisplayName("Should keep running when the cache sweep fails")
    void testSweepFailure() {
        when(cache.cleanup()).thenThrow(new CacheException("Failed to list cache objects", null));

        assertThatCode(() -> housekeeping.sweepCache()).doesNotThrowAnyException();
        verify(cache).cleanup();
    }

    @Test
    @DisplayName("Should trim analytics with the configured retention")
    void testTrimAnalytics() {
        housekeeping.trimAnalytics();

        verify(analytics).trimOlderThan(eq(Duration.ofDays(30)));
    }
}
