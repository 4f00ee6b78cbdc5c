package com.metering.fetch.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metering.fetch.cache.CacheEntryMetadata;
import com.metering.fetch.cache.CacheKeys;
import com.metering.fetch.cache.ObjectCacheStore;
import com.metering.fetch.config.FetchProperties;
import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.domain.FetchResult;
import com.metering.fetch.domain.JobStatus;
import com.metering.fetch.exception.FetchException;
import com.metering.fetch.exception.IllegalJobTransitionException;
import com.metering.fetch.exception.InvalidRequestException;
import com.metering.fetch.exception.JobTerminalFailureException;
import com.metering.fetch.exception.QueueTransportException;
import com.metering.fetch.queue.DeadLetterReason;
import com.metering.fetch.queue.Delivery;
import com.metering.fetch.queue.DurableQueue;
import com.metering.fetch.routing.RequestRouter;
import com.metering.fetch.storage.jpa.QueueJobEntity;
import com.metering.fetch.storage.jpa.QueueJobJpaRepository;
import com.metering.fetch.upstream.PaginatedFetcher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the job lifecycle: enqueueing large requests, running deliveries, retries,
 * cancellation and status lookups.
 *
 * The job row is written before the message is sent; if the send fails the row is
 * removed again and {@link QueueTransportException} is raised. The row store allows one
 * active job per request hash, so identical requests from several instances share a job.
 * Retry decisions use
 * the transport's delivery count, so the row's {@code retryCount} is always
 * {@code attempt - 1} of the delivery being processed.
 */
@Service
public class JobQueueManager {

    private static final Logger log = LoggerFactory.getLogger(JobQueueManager.class);

    private static final Set<JobStatus> FAILABLE = EnumSet.of(JobStatus.PROCESSING);

    private final QueueJobJpaRepository jobs;
    private final DurableQueue<JobMessage> queue;
    private final PaginatedFetcher fetcher;
    private final ObjectCacheStore cache;
    private final RequestRouter router;
    private final BackoffPolicy backoff;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int maxRetries;
    private final Duration jobTimeout;

    public JobQueueManager(
            QueueJobJpaRepository jobs,
            DurableQueue<JobMessage> queue,
            PaginatedFetcher fetcher,
            ObjectCacheStore cache,
            RequestRouter router,
            BackoffPolicy backoff,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry,
            FetchProperties properties) {
        this.jobs = jobs;
        this.queue = queue;
        this.fetcher = fetcher;
        this.cache = cache;
        this.router = router;
        this.backoff = backoff;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.maxRetries = properties.getQueue().getMaxRetries();
        this.jobTimeout = properties.getUpstream().getJobTimeout();
    }

    /**
     * Persist a job in {@code queued} state and hand it to the transport.
     *
     * @return {@code jobId}, or the id of the active job already serving an identical request
     * @throws InvalidRequestException  if the request is malformed
     * @throws QueueTransportException  if the message could not be sent
     */
    public String queueLargeRequest(
            String jobId,
            String site,
            List<String> points,
            Instant startTime,
            Instant endTime,
            String userId,
            FetchOptions options) {

        validate(jobId, site, points, startTime, endTime);
        FetchOptions effective = options == null ? FetchOptions.defaults() : options;
        String requestHash = CacheKeys.requestHash(site, points, startTime, endTime);

        QueueJobEntity job = QueueJobEntity.builder()
            .jobId(jobId)
            .requestHash(requestHash)
            .activeRequestHash(requestHash)
            .site(site)
            .points(List.copyOf(points))
            .startTime(startTime)
            .endTime(endTime)
            .userId(userId)
            .status(JobStatus.QUEUED)
            .priority(effective.priority())
            .outputFormat(effective.format())
            .persistToCache(effective.persistToCache())
            .cacheKey(effective.cacheKey())
            .totalPoints(points.size())
            .estimatedSize(router.estimateSamples(points.size(), startTime, endTime))
            .createdAt(clock.instant())
            .build();
        try {
            jobs.saveAndFlush(job);
        } catch (DataIntegrityViolationException e) {
            Optional<QueueJobEntity> active = jobs.findByActiveRequestHash(requestHash);
            if (active.isEmpty()) {
                throw e;
            }
            log.info("Job {} not created; identical request is served by active job {}",
                jobId, active.get().getJobId());
            return active.get().getJobId();
        }

        try {
            queue.send(new JobMessage(jobId, site, points, startTime, endTime, userId, effective));
        } catch (RuntimeException e) {
            log.error("Failed to enqueue job {} on {}: {}", jobId, queue.name(), e.getMessage(), e);
            removeUnsentJob(jobId);
            throw new QueueTransportException("Failed to enqueue job " + jobId, e);
        }

        countTransition("queued");
        log.info("Queued job {} for site={}, points={}, estimatedSamples={}, priority={}",
            jobId, site, points.size(), job.getEstimatedSize(), effective.priority());
        return jobId;
    }

    /**
     * Run one delivery to completion, retry or terminal failure.
     * Never throws for fetch failures; infrastructure failures propagate and the
     * delivery is redelivered after its lease expires.
     */
    public JobOutcome processJob(Delivery<JobMessage> delivery) {
        JobMessage message = delivery.body();
        String jobId = message.jobId();

        Optional<QueueJobEntity> current = jobs.findById(jobId);
        if (current.isEmpty()) {
            log.warn("Delivery {} references unknown job {}; dropping", delivery.messageId(), jobId);
            queue.ack(delivery);
            return JobOutcome.SKIPPED;
        }
        if (current.get().getStatus().isTerminal()) {
            log.info("Job {} already {}; acknowledging delivery {}", jobId,
                current.get().getStatus().wireName(), delivery.messageId());
            queue.ack(delivery);
            return JobOutcome.SKIPPED;
        }

        int retryCount = delivery.retryCount();
        Instant claimedAt = clock.instant();
        if (transition(jobId, JobStatus.CLAIMABLE, JobStatus.PROCESSING,
                () -> jobs.markProcessing(jobId, JobStatus.CLAIMABLE, retryCount, claimedAt)) == 0) {
            log.info("Job {} was cancelled before processing started", jobId);
            queue.ack(delivery);
            return JobOutcome.SKIPPED;
        }
        log.info("Processing job {} (attempt {}/{})", jobId, delivery.attempt(), maxRetries);

        try {
            FetchResult result = fetcher.fetchAll(message.site(), message.points(),
                message.startTime(), message.endTime(), jobTimeout,
                (percent, processed, total) -> jobs.updateProgress(jobId, percent, processed, total));

            if (isCancelled(jobId)) {
                log.info("Job {} cancelled while fetching; discarding result", jobId);
                queue.ack(delivery);
                return JobOutcome.SKIPPED;
            }

            byte[] payload = serialize(result);
            String cacheKey = null;
            if (message.options().persistToCache()) {
                cacheKey = message.options().cacheKey() != null
                    ? message.options().cacheKey()
                    : CacheKeys.forRequest(message.site(), message.points(), message.startTime(),
                        message.endTime(), message.options().format());
                cache.put(cacheKey, payload, "application/json", new CacheEntryMetadata(
                    message.site(), message.points().size(), result.samplesCount(),
                    Map.of("job-id", jobId, "truncated", Boolean.toString(result.truncated()))));
            }

            Instant now = clock.instant();
            String finalKey = cacheKey;
            int updated = transition(jobId, FAILABLE, JobStatus.COMPLETED,
                () -> jobs.markCompleted(jobId, result.samplesCount(), payload.length, finalKey,
                    result.truncated(), Duration.between(claimedAt, now).toMillis(), now));
            queue.ack(delivery);
            if (updated == 0) {
                log.info("Job {} left processing before completion was recorded", jobId);
                return JobOutcome.SKIPPED;
            }
            countTransition("completed");
            log.info("Job {} completed: {} samples, {} bytes, {} pages{}", jobId, result.samplesCount(),
                payload.length, result.pagesFetched(), result.truncated() ? " (truncated)" : "");
            return JobOutcome.COMPLETED;

        } catch (RuntimeException e) {
            return handleFailure(delivery, FetchException.wrap(e), claimedAt);
        }
    }

    private JobOutcome handleFailure(Delivery<JobMessage> delivery, FetchException error, Instant claimedAt) {
        String jobId = delivery.body().jobId();
        if (isCancelled(jobId)) {
            log.info("Job {} cancelled while fetching; dropping failure: {}", jobId, error.getMessage());
            queue.ack(delivery);
            return JobOutcome.SKIPPED;
        }

        int retryCount = delivery.retryCount();
        boolean retryable = error.getCategory() != ErrorCategory.CLIENT_FAULT;

        if (retryable && retryCount + 1 < maxRetries && reschedule(delivery, backoff.delayFor(retryCount))) {
            transition(jobId, FAILABLE, JobStatus.RETRYING,
                () -> jobs.markRetrying(jobId, retryCount + 1, error.getMessage(), error.getCategory()));
            countTransition("retrying");
            log.warn("Job {} failed (attempt {}/{}), retrying in {}: {}",
                jobId, delivery.attempt(), maxRetries, backoff.delayFor(retryCount), error.getMessage());
            return JobOutcome.RETRYING;
        }

        JobTerminalFailureException terminal = new JobTerminalFailureException(jobId, retryCount, error);
        // the DLQ message must exist before the row turns terminal
        queue.deadLetter(delivery, new DeadLetterReason(terminal.getMessage(), terminal.getCategory(),
            stackTraceOf(error)));
        Instant now = clock.instant();
        transition(jobId, FAILABLE, JobStatus.FAILED,
            () -> jobs.markFailed(jobId, FAILABLE, terminal.getMessage(), terminal.getCategory(), retryCount,
                Duration.between(claimedAt, now).toMillis(), now));
        countTransition("failed");
        log.error("Job {} failed permanently after {} attempt(s) [{}]: {}", jobId, delivery.attempt(),
            terminal.getCategory(), terminal.getMessage());
        return JobOutcome.FAILED;
    }

    private boolean reschedule(Delivery<JobMessage> delivery, Duration delay) {
        try {
            queue.retry(delivery, delay);
            return true;
        } catch (RuntimeException e) {
            log.error("Could not schedule retry for job {}; failing it", delivery.body().jobId(), e);
            return false;
        }
    }

    public Optional<JobSnapshot> getJobStatus(String jobId) {
        return jobs.findById(jobId).map(JobSnapshot::from);
    }

    /**
     * Most recent job created for an identical request, if any.
     */
    public Optional<JobSnapshot> findLatestForRequest(String requestHash) {
        return jobs.findFirstByRequestHashOrderByCreatedAtDesc(requestHash).map(JobSnapshot::from);
    }

    /**
     * @return {@code true} if the job moved to {@code cancelled}; {@code false} if it is unknown or already terminal
     */
    public boolean cancelJob(String jobId) {
        int updated = transition(jobId, JobStatus.ACTIVE, JobStatus.CANCELLED,
            () -> jobs.markCancelled(jobId, JobStatus.ACTIVE, clock.instant()));
        if (updated == 1) {
            countTransition("cancelled");
            log.info("Job {} cancelled", jobId);
            return true;
        }
        return false;
    }

    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : jobs.countGroupedByStatus()) {
            counts.put((JobStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    public long queueDepth() {
        return queue.depth();
    }

    private boolean isCancelled(String jobId) {
        return jobs.findById(jobId)
            .map(job -> job.getStatus() == JobStatus.CANCELLED)
            .orElse(true);
    }

    private void removeUnsentJob(String jobId) {
        try {
            jobs.deleteById(jobId);
        } catch (RuntimeException e) {
            log.error("Failed to remove unsent job {}; it will stay queued until archived", jobId, e);
        }
    }

    private byte[] serialize(FetchResult result) {
        try {
            return objectMapper.writeValueAsBytes(result.data());
        } catch (JsonProcessingException e) {
            throw new FetchException("Failed to serialize job result", ErrorCategory.SERVER_FAULT, e);
        }
    }

    private void countTransition(String transition) {
        meterRegistry.counter("fetch.jobs", "transition", transition).increment();
    }

    private static int transition(String jobId, Collection<JobStatus> from, JobStatus to, UpdateStatement update) {
        for (JobStatus source : from) {
            if (!source.canTransitionTo(to)) {
                throw new IllegalJobTransitionException(jobId, source, to);
            }
        }
        return update.execute();
    }

    private static void validate(String jobId, String site, List<String> points, Instant start, Instant end) {
        if (jobId == null || jobId.isBlank()) {
            throw new InvalidRequestException("jobId is required");
        }
        if (site == null || site.isBlank()) {
            throw new InvalidRequestException("site is required");
        }
        if (points == null || points.isEmpty()) {
            throw new InvalidRequestException("at least one point is required");
        }
        if (start == null || end == null || start.isAfter(end)) {
            throw new InvalidRequestException("startTime must not be after endTime");
        }
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        String trace = writer.toString();
        return trace.length() > 8000 ? trace.substring(0, 8000) : trace;
    }

    @FunctionalInterface
    private interface UpdateStatement {
        int execute();
    }
}
