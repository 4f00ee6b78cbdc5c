package com.metering.fetch.dlq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metering.fetch.analytics.AnalyticsSink;
import com.metering.fetch.cache.CacheKeys;
import com.metering.fetch.domain.JobStatus;
import com.metering.fetch.exception.JobNotFoundException;
import com.metering.fetch.jobs.JobIds;
import com.metering.fetch.jobs.JobQueueManager;
import com.metering.fetch.storage.blob.BlobMetadata;
import com.metering.fetch.storage.blob.BlobStore;
import com.metering.fetch.storage.jpa.DlqRecoveryEntity;
import com.metering.fetch.storage.jpa.DlqRecoveryJpaRepository;
import com.metering.fetch.storage.jpa.QueueJobEntity;
import com.metering.fetch.storage.jpa.QueueJobJpaRepository;
import com.metering.fetch.storage.jpa.RecoveryStatus;
import com.metering.fetch.storage.jpa.UserNotificationEntity;
import com.metering.fetch.storage.jpa.UserNotificationJpaRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Processes dead-lettered jobs.
 *
 * For each message the job is marked failed, diagnostics are written to
 * {@code dlq/failures/{jobId}.json}, and the failure is routed by classification:
 * recoverable failures get one recovery record, user errors notify the requester,
 * everything else alerts operators. Every step is idempotent so redelivered DLQ
 * messages are harmless, and a failing step is counted without failing the batch.
 */
@Service
public class DeadLetterHandler {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterHandler.class);

    static final String DIAGNOSTICS_PREFIX = "dlq/failures/";
    static final String NOTIFICATION_TITLE = "Chart Generation Failed";
    private static final Set<JobStatus> FAILABLE = EnumSet.of(JobStatus.PROCESSING);
    private static final int MAX_LIST_LIMIT = 100;

    private final QueueJobJpaRepository jobs;
    private final DlqRecoveryJpaRepository recoveries;
    private final UserNotificationJpaRepository notifications;
    private final BlobStore blobStore;
    private final AnalyticsSink analytics;
    private final ErrorClassifier classifier;
    private final JobQueueManager jobQueueManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public DeadLetterHandler(
            QueueJobJpaRepository jobs,
            DlqRecoveryJpaRepository recoveries,
            UserNotificationJpaRepository notifications,
            BlobStore blobStore,
            AnalyticsSink analytics,
            ErrorClassifier classifier,
            JobQueueManager jobQueueManager,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.jobs = jobs;
        this.recoveries = recoveries;
        this.notifications = notifications;
        this.blobStore = blobStore;
        this.analytics = analytics;
        this.classifier = classifier;
        this.jobQueueManager = jobQueueManager;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public DlqBatchResult processBatch(List<DeadLetterMessage> messages) {
        int stored = 0;
        int alerted = 0;
        int recovered = 0;
        int errors = 0;

        for (DeadLetterMessage message : messages) {
            try {
                HandledFailure handled = handleFailedJob(message);
                stored += handled.diagnosticsStored() ? 1 : 0;
                alerted += handled.alerted() ? 1 : 0;
                recovered += handled.recoveryCreated() ? 1 : 0;
                errors += handled.failedSteps();
            } catch (RuntimeException e) {
                errors++;
                log.error("Failed to process dead-lettered job {}: {}", message.jobId(), e.getMessage(), e);
            }
        }

        DlqBatchResult result = new DlqBatchResult(stored, alerted, recovered, errors);
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("messages", (double) messages.size());
        values.put("stored", (double) stored);
        values.put("alerted", (double) alerted);
        values.put("recovered", (double) recovered);
        values.put("errors", (double) errors);
        analytics.writeDataPoint("dlq_batch_processed", Map.of(), values);
        return result;
    }

    /**
     * Handle one dead-lettered job. Storage failures in individual steps are logged
     * and reported in the returned {@link HandledFailure}.
     */
    public HandledFailure handleFailedJob(DeadLetterMessage message) {
        markFailed(message);
        int failedSteps = 0;

        boolean diagnosticsStored = storeFailureDetails(message);
        if (!diagnosticsStored) {
            failedSteps++;
        }

        FailureClassification classification = classifier.classify(message.category(), message.error());
        meterRegistry.counter("fetch.dlq", "classification", classification.name().toLowerCase(Locale.ROOT)).increment();
        log.warn("Dead-lettered job {} classified {} [{}]: {}", message.jobId(), classification,
            message.category(), message.error());

        boolean recoveryCreated = false;
        boolean alerted = false;
        switch (classification) {
            case RECOVERABLE:
                Optional<Boolean> created = attemptRecovery(message, classification);
                recoveryCreated = created.orElse(false);
                failedSteps += created.isEmpty() ? 1 : 0;
                break;
            case USER_ERROR:
                failedSteps += notifyUser(message) ? 0 : 1;
                break;
            default:
                alertOperators(message, classification);
                alerted = true;
                break;
        }
        return new HandledFailure(message.jobId(), classification, diagnosticsStored, recoveryCreated, alerted,
            failedSteps);
    }

    public DlqStats getStats() {
        Instant since = clock.instant().minus(Duration.ofHours(24));
        Double avgRetries = jobs.averageRetryCount(JobStatus.FAILED);
        long pending = recoveries.countByStatus(RecoveryStatus.PENDING);
        long recovered = recoveries.countByStatus(RecoveryStatus.RECOVERED);
        long abandoned = recoveries.countByStatus(RecoveryStatus.ABANDONED);
        return new DlqStats(
            jobs.countByStatus(JobStatus.FAILED),
            jobs.countByStatusAndFailedAtAfter(JobStatus.FAILED, since),
            avgRetries == null ? 0.0 : Math.round(avgRetries * 100.0) / 100.0,
            new DlqStats.RecoveryStats(pending + recovered + abandoned, pending, recovered, abandoned));
    }

    public List<FailureSummary> listRecentFailures(int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return jobs.findByStatusOrderByFailedAtDesc(JobStatus.FAILED, PageRequest.of(0, bounded)).stream()
            .map(job -> new FailureSummary(job.getJobId(), job.getSite(), job.getPoints().size(),
                job.getErrorMessage(), job.getErrorCategory(), job.getRetryCount(), job.getCreatedAt(),
                job.getFailedAt()))
            .collect(Collectors.toList());
    }

    /**
     * Re-enqueue a pending recovery record as a fresh job.
     *
     * @return the new job id, or empty if the record is not pending
     * @throws JobNotFoundException if no recovery record exists for the job
     */
    public Optional<String> requeue(String jobId) {
        DlqRecoveryEntity record = recoveries.findByJobId(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
        if (record.getStatus() != RecoveryStatus.PENDING) {
            return Optional.empty();
        }

        DeadLetterMessage original = readOriginal(record);
        String newJobId = jobQueueManager.queueLargeRequest(JobIds.newJobId(
            CacheKeys.requestHash(original.site(), original.points(), original.startTime(), original.endTime()),
            clock), original.site(), original.points(), original.startTime(),
            original.endTime(), original.userId(), original.options());

        if (recoveries.resolve(jobId, RecoveryStatus.RECOVERED, newJobId, clock.instant()) == 0) {
            log.warn("Recovery record for job {} was resolved concurrently; requeued job {} stands", jobId, newJobId);
        }
        log.info("Recovered dead-lettered job {} as {}", jobId, newJobId);
        return Optional.of(newJobId);
    }

    /**
     * @return {@code true} if a pending record was abandoned
     * @throws JobNotFoundException if no recovery record exists for the job
     */
    public boolean abandon(String jobId) {
        if (!recoveries.existsByJobId(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        boolean abandoned = recoveries.resolve(jobId, RecoveryStatus.ABANDONED, null, clock.instant()) == 1;
        if (abandoned) {
            log.info("Recovery for dead-lettered job {} abandoned", jobId);
        }
        return abandoned;
    }

    private void markFailed(DeadLetterMessage message) {
        Instant failedAt = message.failedAt() != null ? message.failedAt() : clock.instant();
        int updated = jobs.markFailed(message.jobId(), FAILABLE, truncate(message.error()), message.category(),
            message.retryCount(), null, failedAt);
        if (updated == 0) {
            jobs.findById(message.jobId()).map(QueueJobEntity::getStatus).ifPresentOrElse(
                status -> log.debug("Job {} already {}; leaving status unchanged", message.jobId(), status),
                () -> log.warn("Dead-lettered job {} has no job record", message.jobId()));
        }
    }

    private boolean storeFailureDetails(DeadLetterMessage message) {
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("jobId", message.jobId());
            details.put("site", message.site());
            details.put("points", message.points());
            details.put("startTime", message.startTime());
            details.put("endTime", message.endTime());
            details.put("error", message.error());
            details.put("category", message.category());
            details.put("retryCount", message.retryCount());
            details.put("stackTrace", message.stackTrace());
            details.put("failedAt", message.failedAt());
            details.put("recordedAt", clock.instant());

            byte[] body = objectMapper.writeValueAsString(details).getBytes(StandardCharsets.UTF_8);
            blobStore.put(DIAGNOSTICS_PREFIX + message.jobId() + ".json", body, new BlobMetadata(
                "application/json", null, Map.of(
                    "error-category", message.category().name(),
                    "timestamp", clock.instant().toString())));
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to store diagnostics for job {}: {}", message.jobId(), e.getMessage());
            return false;
        }
    }

    /**
     * @return {@code true} if created, {@code false} if it already existed, empty on storage failure
     */
    private Optional<Boolean> attemptRecovery(DeadLetterMessage message, FailureClassification classification) {
        if (recoveries.existsByJobId(message.jobId())) {
            log.debug("Recovery record for job {} already exists", message.jobId());
            return Optional.of(false);
        }
        try {
            recoveries.saveAndFlush(DlqRecoveryEntity.builder()
                .jobId(message.jobId())
                .originalMessage(objectMapper.writeValueAsString(message))
                .classification(classification.name())
                .status(RecoveryStatus.PENDING)
                .createdAt(clock.instant())
                .build());
            log.info("Recovery record created for job {}", message.jobId());
            return Optional.of(true);
        } catch (DataIntegrityViolationException e) {
            log.debug("Recovery record for job {} created concurrently", message.jobId());
            return Optional.of(false);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to create recovery record for job {}: {}", message.jobId(), e.getMessage());
            return Optional.empty();
        }
    }

    private boolean notifyUser(DeadLetterMessage message) {
        String userId = message.userId();
        if (userId == null || userId.isBlank()) {
            log.warn("No user to notify for failed job {}", message.jobId());
            return true;
        }
        try {
            notifications.save(UserNotificationEntity.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .notificationType("job_failed")
                .title(NOTIFICATION_TITLE)
                .messageText(truncate(String.format("Your chart request for %s could not be completed: %s",
                    message.site(), message.error())))
                .jobId(message.jobId())
                .createdAt(clock.instant())
                .build());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to notify user {} about job {}: {}", userId, message.jobId(), e.getMessage());
            return false;
        }
    }

    private void alertOperators(DeadLetterMessage message, FailureClassification classification) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("jobId", message.jobId());
        context.put("site", message.site());
        context.put("classification", classification.name());
        context.put("error", message.error());
        context.put("retryCount", Integer.toString(message.retryCount()));
        analytics.critical("dlq_system_error", context);
    }

    private DeadLetterMessage readOriginal(DlqRecoveryEntity record) {
        try {
            return objectMapper.readValue(record.getOriginalMessage(), DeadLetterMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt recovery record for job " + record.getJobId(), e);
        }
    }

    private static String truncate(String text) {
        return text == null || text.length() <= 2000 ? text : text.substring(0, 2000);
    }

    /**
     * What happened to one dead-lettered job.
     */
    public record HandledFailure(
        String jobId,
        FailureClassification classification,
        boolean diagnosticsStored,
        boolean recoveryCreated,
        boolean alerted,
        int failedSteps
    ) {
    }
}
