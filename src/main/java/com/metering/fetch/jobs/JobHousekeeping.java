package com.metering.fetch.jobs;

import com.metering.fetch.analytics.RequestAnalyticsRecorder;
import com.metering.fetch.cache.ObjectCacheStore;
import com.metering.fetch.config.FetchProperties;
import com.metering.fetch.domain.JobStatus;
import com.metering.fetch.storage.jpa.JobHistoryEntity;
import com.metering.fetch.storage.jpa.JobHistoryJpaRepository;
import com.metering.fetch.storage.jpa.QueueJobEntity;
import com.metering.fetch.storage.jpa.QueueJobJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Periodic maintenance: archives old terminal jobs, sweeps the cache and trims analytics.
 */
@Component
@ConditionalOnProperty(prefix = "fetch.jobs", name = "housekeeping-enabled", havingValue = "true", matchIfMissing = true)
public class JobHousekeeping {

    private static final Logger log = LoggerFactory.getLogger(JobHousekeeping.class);

    private final QueueJobJpaRepository jobs;
    private final JobHistoryJpaRepository history;
    private final ObjectCacheStore cache;
    private final RequestAnalyticsRecorder analytics;
    private final FetchProperties properties;
    private final Clock clock;

    public JobHousekeeping(
            QueueJobJpaRepository jobs,
            JobHistoryJpaRepository history,
            ObjectCacheStore cache,
            RequestAnalyticsRecorder analytics,
            FetchProperties properties,
            Clock clock) {
        this.jobs = jobs;
        this.history = history;
        this.cache = cache;
        this.analytics = analytics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Move terminal jobs older than the retention window into {@code job_history}.
     *
     * @return number of jobs archived
     */
    @Scheduled(fixedDelayString = "#{@fetchProperties.jobs.archiveInterval.toMillis()}",
               initialDelayString = "#{@fetchProperties.jobs.archiveInterval.toMillis()}")
    @Transactional
    public int archiveTerminalJobs() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getJobs().getRetention());
        List<QueueJobEntity> expired = jobs.findByStatusInAndCreatedAtBefore(JobStatus.TERMINAL, cutoff);

        for (QueueJobEntity job : expired) {
            history.save(JobHistoryEntity.builder()
                .jobId(job.getJobId())
                .site(job.getSite())
                .pointsCount(job.getPoints().size())
                .status(job.getStatus())
                .durationMs(job.getProcessingTimeMs())
                .samplesCount(job.getSamplesCount())
                .dataSize(job.getDataSize())
                .errorMessage(job.getErrorMessage())
                .createdAt(job.getCreatedAt())
                .completedAt(firstNonNull(job.getCompletedAt(), job.getFailedAt(), job.getCancelledAt()))
                .archivedAt(now)
                .build());
        }
        jobs.deleteAll(expired);

        if (!expired.isEmpty()) {
            log.info("Archived {} terminal jobs created before {}", expired.size(), cutoff);
        }
        return expired.size();
    }

    @Scheduled(fixedDelayString = "#{@fetchProperties.cache.cleanupInterval.toMillis()}",
               initialDelayString = "#{@fetchProperties.cache.cleanupInterval.toMillis()}")
    public void sweepCache() {
        try {
            cache.cleanup();
        } catch (RuntimeException e) {
            log.error("Cache sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "#{@fetchProperties.jobs.archiveInterval.toMillis()}",
               initialDelayString = "#{@fetchProperties.jobs.archiveInterval.toMillis()}")
    public void trimAnalytics() {
        try {
            analytics.trimOlderThan(properties.getAnalytics().getRetention());
        } catch (RuntimeException e) {
            log.error("Analytics trim failed: {}", e.getMessage(), e);
        }
    }

    private static Instant firstNonNull(Instant... candidates) {
        for (Instant candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
