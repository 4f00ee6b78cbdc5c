package com.metering.fetch.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metering.fetch.analytics.RequestAnalyticsRecorder;
import com.metering.fetch.analytics.RequestOutcome;
import com.metering.fetch.analytics.RouteStats;
import com.metering.fetch.cache.CacheEntryMetadata;
import com.metering.fetch.cache.CacheKeys;
import com.metering.fetch.cache.CacheStats;
import com.metering.fetch.cache.CachedPayload;
import com.metering.fetch.cache.ObjectCacheStore;
import com.metering.fetch.config.FetchProperties;
import com.metering.fetch.config.RequestGuardConfig;
import com.metering.fetch.domain.FetchResult;
import com.metering.fetch.domain.JobStatus;
import com.metering.fetch.domain.PointSeries;
import com.metering.fetch.domain.RouteType;
import com.metering.fetch.exception.CacheException;
import com.metering.fetch.exception.FetchException;
import com.metering.fetch.exception.InvalidRequestException;
import com.metering.fetch.exception.JobNotFoundException;
import com.metering.fetch.exception.JobNotReadyException;
import com.metering.fetch.exception.JobResultExpiredException;
import com.metering.fetch.jobs.FetchOptions;
import com.metering.fetch.jobs.JobIds;
import com.metering.fetch.jobs.JobQueueManager;
import com.metering.fetch.jobs.JobSnapshot;
import com.metering.fetch.routing.RequestRouter;
import com.metering.fetch.routing.RoutingDecision;
import com.metering.fetch.storage.blob.BlobStore;
import com.metering.fetch.upstream.PaginatedFetcher;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for fetch requests.
 *
 * Routes each request by estimated size: small requests are fetched inline, medium
 * ones go through the object cache, large ones become queued jobs. Identical queued
 * requests coalesce onto the existing job while it is active (locally through striped
 * locks, across instances through the job store), and a recently
 * completed job is served straight from its cached result.
 */
@Service
public class TimeseriesFetchService {

    private static final Logger log = LoggerFactory.getLogger(TimeseriesFetchService.class);

    private static final TypeReference<LinkedHashMap<String, PointSeries>> SERIES_MAP = new TypeReference<>() { };
    private static final int LOCK_STRIPES = 64;

    private final RequestRouter router;
    private final PaginatedFetcher fetcher;
    private final ObjectCacheStore cache;
    private final JobQueueManager jobQueueManager;
    private final RequestAnalyticsRecorder analytics;
    private final BlobStore blobStore;
    private final CircuitBreaker upstreamBreaker;
    private final Executor cacheWriteExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final FetchProperties properties;
    private final ReentrantLock[] requestLocks = new ReentrantLock[LOCK_STRIPES];

    public TimeseriesFetchService(
            RequestRouter router,
            PaginatedFetcher fetcher,
            ObjectCacheStore cache,
            JobQueueManager jobQueueManager,
            RequestAnalyticsRecorder analytics,
            BlobStore blobStore,
            CircuitBreakerRegistry circuitBreakerRegistry,
            @Qualifier("cacheWriteExecutor") Executor cacheWriteExecutor,
            ObjectMapper objectMapper,
            Clock clock,
            FetchProperties properties) {
        this.router = router;
        this.fetcher = fetcher;
        this.cache = cache;
        this.jobQueueManager = jobQueueManager;
        this.analytics = analytics;
        this.blobStore = blobStore;
        this.upstreamBreaker = circuitBreakerRegistry.circuitBreaker("upstream");
        this.cacheWriteExecutor = cacheWriteExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            requestLocks[i] = new ReentrantLock();
        }
    }

    /**
     * @throws InvalidRequestException on malformed input
     * @throws FetchException          on upstream or queue failures of synchronous routes
     */
    public FetchResponse fetchTimeseries(FetchRequest request) {
        validate(request);
        String requestId = currentRequestId();
        long startNanos = System.nanoTime();
        RoutingDecision decision = router.decide(request.points().size(), request.startTime(),
            request.endTime(), request.routeOverride());

        log.info("Request {} site={} points={} estimate={} route={}{}", requestId, request.site(),
            request.points().size(), decision.estimatedSamples(), decision.route().wireName(),
            decision.overridden() ? " (override)" : "");

        try {
            FetchResponse response;
            switch (decision.route()) {
                case DIRECT:
                    response = fetchDirect(request, decision, requestId, startNanos);
                    break;
                case CACHED:
                    response = fetchCached(request, decision, requestId, startNanos);
                    break;
                default:
                    response = fetchQueued(request, decision, requestId, startNanos);
                    break;
            }
            recordOutcome(request, decision, requestId, startNanos, response, null);
            return response;

        } catch (RuntimeException e) {
            recordOutcome(request, decision, requestId, startNanos, null, e);
            throw e;
        }
    }

    public Optional<JobSnapshot> getJobStatus(String jobId) {
        return jobQueueManager.getJobStatus(jobId);
    }

    public boolean cancelJob(String jobId) {
        return jobQueueManager.cancelJob(jobId);
    }

    /**
     * Cached result of a completed job.
     *
     * @throws JobNotFoundException       if the job does not exist
     * @throws JobNotReadyException       if the job is not completed
     * @throws JobResultExpiredException  if the result is no longer cached
     */
    public DataResponse getJobData(String jobId) {
        long startNanos = System.nanoTime();
        JobSnapshot job = jobQueueManager.getJobStatus(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.status() != JobStatus.COMPLETED) {
            throw new JobNotReadyException(jobId, job.status());
        }
        if (job.cacheKey() == null) {
            throw new JobResultExpiredException(jobId);
        }
        CachedPayload payload = cache.get(job.cacheKey()).orElseThrow(() -> new JobResultExpiredException(jobId));
        return new DataResponse(decode(payload), new ResponseMeta(
            currentRequestId(), RouteType.QUEUED, true,
            elapsedMillis(startNanos), clock.instant(), job.truncated(), job.estimatedSize(), jobId));
    }

    public ServiceStats getStats() {
        CacheStats cacheStats;
        try {
            cacheStats = cache.getStats();
        } catch (RuntimeException e) {
            log.warn("Cache stats unavailable: {}", e.getMessage());
            cacheStats = null;
        }
        List<RouteStats> routes = analytics.summarizeSince(Duration.ofHours(24));
        return new ServiceStats(jobQueueManager.countByStatus(), jobQueueManager.queueDepth(), cacheStats,
            routes, clock.instant());
    }

    public HealthReport health() {
        Map<String, HealthReport.ComponentHealth> components = new LinkedHashMap<>();
        try {
            Map<JobStatus, Long> counts = jobQueueManager.countByStatus();
            components.put("rowStore", HealthReport.ComponentHealth.up(
                counts.values().stream().mapToLong(Long::longValue).sum() + " jobs"));
        } catch (RuntimeException e) {
            components.put("rowStore", HealthReport.ComponentHealth.down(e.getMessage()));
        }
        try {
            components.put("blobStore", blobStore.isHealthy()
                ? HealthReport.ComponentHealth.up("reachable")
                : HealthReport.ComponentHealth.down("unreachable"));
        } catch (RuntimeException e) {
            components.put("blobStore", HealthReport.ComponentHealth.down(e.getMessage()));
        }
        try {
            components.put("queue", HealthReport.ComponentHealth.up("depth " + jobQueueManager.queueDepth()));
        } catch (RuntimeException e) {
            components.put("queue", HealthReport.ComponentHealth.down(e.getMessage()));
        }
        CircuitBreaker.State state = upstreamBreaker.getState();
        components.put("upstream", state == CircuitBreaker.State.OPEN
            ? HealthReport.ComponentHealth.down("circuit " + state)
            : HealthReport.ComponentHealth.up("circuit " + state));

        boolean healthy = components.values().stream().allMatch(c -> "ok".equals(c.status()));
        return new HealthReport(healthy ? "ok" : "degraded", clock.instant(), components);
    }

    private DataResponse fetchDirect(FetchRequest request, RoutingDecision decision, String requestId,
                                     long startNanos) {
        FetchResult result = fetcher.fetchAll(request.site(), request.points(), request.startTime(),
            request.endTime(), timeoutFor(request));
        return inline(result.data(), decision, requestId, startNanos, false, result.truncated(), null);
    }

    private DataResponse fetchCached(FetchRequest request, RoutingDecision decision, String requestId,
                                     long startNanos) {
        String key = CacheKeys.forRequest(request.site(), request.points(), request.startTime(),
            request.endTime(), request.format());

        Optional<DataResponse> hit = readCache(key, decision, requestId, startNanos, null);
        if (hit.isPresent()) {
            return hit.get();
        }

        FetchResult result = fetcher.fetchAll(request.site(), request.points(), request.startTime(),
            request.endTime(), timeoutFor(request));
        writeBehind(key, request, result);
        return inline(result.data(), decision, requestId, startNanos, false, result.truncated(), null);
    }

    private FetchResponse fetchQueued(FetchRequest request, RoutingDecision decision, String requestId,
                                      long startNanos) {
        String requestHash = CacheKeys.requestHash(request.site(), request.points(), request.startTime(),
            request.endTime());
        ReentrantLock lock = requestLocks[Math.floorMod(requestHash.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            Optional<JobSnapshot> existing = jobQueueManager.findLatestForRequest(requestHash);
            if (existing.isPresent()) {
                JobSnapshot job = existing.get();
                if (!job.status().isTerminal()) {
                    log.info("Request {} coalesced onto active job {}", requestId, job.jobId());
                    return queued(job.jobId(), job.status(), job.message(), requestId);
                }
                Optional<DataResponse> reused = reuseCompleted(job, decision, requestId, startNanos);
                if (reused.isPresent()) {
                    return reused.get();
                }
            }

            String jobId = JobIds.newJobId(requestHash, clock);
            String cacheKey = CacheKeys.forRequest(request.site(), request.points(), request.startTime(),
                request.endTime(), request.format());
            String queuedId = jobQueueManager.queueLargeRequest(jobId, request.site(), request.points(),
                request.startTime(), request.endTime(), request.userId(),
                new FetchOptions(request.format(), true, cacheKey, request.priority()));
            if (!queuedId.equals(jobId)) {
                // another instance queued the same request first
                Optional<JobSnapshot> active = jobQueueManager.getJobStatus(queuedId);
                if (active.isPresent()) {
                    log.info("Request {} coalesced onto active job {}", requestId, queuedId);
                    return queued(queuedId, active.get().status(), active.get().message(), requestId);
                }
            }
            return queued(queuedId, JobStatus.QUEUED, "Your request is queued and will be processed shortly.",
                requestId);
        } finally {
            lock.unlock();
        }
    }

    private Optional<DataResponse> reuseCompleted(JobSnapshot job, RoutingDecision decision, String requestId,
                                                  long startNanos) {
        if (job.status() != JobStatus.COMPLETED || job.cacheKey() == null || job.completedAt() == null) {
            return Optional.empty();
        }
        Instant windowStart = clock.instant().minus(properties.getJobs().getRecentCompletionWindow());
        if (job.completedAt().isBefore(windowStart)) {
            return Optional.empty();
        }
        Optional<DataResponse> hit = readCache(job.cacheKey(), decision, requestId, startNanos, job.jobId());
        hit.ifPresent(response -> log.info("Request {} served from completed job {}", requestId, job.jobId()));
        return hit;
    }

    private Optional<DataResponse> readCache(String key, RoutingDecision decision, String requestId,
                                             long startNanos, String jobId) {
        try {
            return cache.get(key).map(payload -> inline(decode(payload), decision, requestId, startNanos, true,
                Boolean.parseBoolean(payload.tag("truncated")), jobId));
        } catch (CacheException e) {
            log.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeBehind(String key, FetchRequest request, FetchResult result) {
        try {
            cacheWriteExecutor.execute(() -> {
                try {
                    byte[] payload = objectMapper.writeValueAsBytes(result.data());
                    cache.put(key, payload, "application/json", new CacheEntryMetadata(request.site(),
                        request.points().size(), result.samplesCount(),
                        Map.of("truncated", Boolean.toString(result.truncated()))));
                } catch (IOException | RuntimeException e) {
                    log.warn("Cache write failed for {}: {}", key, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            cache.recordError();
            log.warn("Cache write for {} rejected, result not cached: {}", key, e.getMessage());
        }
    }

    private Map<String, PointSeries> decode(CachedPayload payload) {
        try {
            return objectMapper.readValue(payload.payload(), SERIES_MAP);
        } catch (IOException e) {
            throw new CacheException("Corrupt cached payload " + payload.key(), e);
        }
    }

    private DataResponse inline(Map<String, PointSeries> data, RoutingDecision decision, String requestId,
                                long startNanos, boolean cacheHit, boolean truncated, String jobId) {
        return new DataResponse(data, new ResponseMeta(requestId, decision.route(), cacheHit,
            elapsedMillis(startNanos), clock.instant(), truncated, decision.estimatedSamples(), jobId));
    }

    private QueuedResponse queued(String jobId, JobStatus status, String message, String requestId) {
        return new QueuedResponse(status.wireName(), jobId, "/jobs/" + jobId,
            properties.getJobs().getPollIntervalHint().toMillis(), message, requestId);
    }

    private Duration timeoutFor(FetchRequest request) {
        return request.timeout() != null ? request.timeout() : properties.getUpstream().getDirectTimeout();
    }

    private void recordOutcome(FetchRequest request, RoutingDecision decision, String requestId, long startNanos,
                               FetchResponse response, RuntimeException error) {
        boolean cacheHit = response instanceof DataResponse data && data.meta().cacheHit();
        String jobId = response instanceof QueuedResponse queued ? queued.jobId()
            : response instanceof DataResponse data ? data.meta().jobId() : null;
        analytics.record(new RequestOutcome(requestId, request.site(), request.points().size(), decision.route(),
            cacheHit, decision.estimatedSamples(), elapsedMillis(startNanos), error == null,
            error == null ? null : error.getMessage(), jobId));
    }

    /** Correlation id of the HTTP request when there is one, otherwise a fresh id. */
    private static String currentRequestId() {
        String fromMdc = MDC.get(RequestGuardConfig.REQUEST_ID_MDC_KEY);
        return fromMdc != null ? fromMdc : RequestGuardConfig.newRequestId();
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private static void validate(FetchRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request is required");
        }
        if (request.site() == null || request.site().isBlank()) {
            throw new InvalidRequestException("site is required");
        }
        if (request.points().isEmpty() || request.points().stream().anyMatch(p -> p == null || p.isBlank())) {
            throw new InvalidRequestException("points must contain at least one non-blank point name");
        }
        if (request.startTime() == null || request.endTime() == null) {
            throw new InvalidRequestException("start_time and end_time are required");
        }
        if (request.startTime().isAfter(request.endTime())) {
            throw new InvalidRequestException("start_time must not be after end_time");
        }
        if (request.timeout() != null && (request.timeout().isZero() || request.timeout().isNegative())) {
            throw new InvalidRequestException("timeout must be positive");
        }
    }
}
