package com.metering.fetch.analytics;

import com.metering.fetch.storage.jpa.RequestAnalyticsEntity;
import com.metering.fetch.storage.jpa.RequestAnalyticsJpaRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Records per-request analytics rows and request timers.
 * Failures here are logged and never reach the caller.
 */
@Component
public class RequestAnalyticsRecorder {

    private static final Logger log = LoggerFactory.getLogger(RequestAnalyticsRecorder.class);

    private final RequestAnalyticsJpaRepository repository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public RequestAnalyticsRecorder(RequestAnalyticsJpaRepository repository, MeterRegistry meterRegistry, Clock clock) {
        this.repository = repository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public void record(RequestOutcome outcome) {
        Timer.builder("fetch.requests")
            .tag("route", outcome.route() == null ? "none" : outcome.route().wireName())
            .tag("outcome", outcome.success() ? "success" : "failure")
            .tag("cache_hit", Boolean.toString(outcome.cacheHit()))
            .description("Fetch requests by route and outcome")
            .register(meterRegistry)
            .record(outcome.durationMs(), TimeUnit.MILLISECONDS);

        try {
            repository.save(RequestAnalyticsEntity.builder()
                .requestId(outcome.requestId())
                .site(outcome.site())
                .pointsCount(outcome.pointsCount())
                .routeType(outcome.route())
                .cacheHit(outcome.cacheHit())
                .estimatedSize(outcome.estimatedSize())
                .durationMs(outcome.durationMs())
                .success(outcome.success())
                .errorMessage(truncate(outcome.error()))
                .jobId(outcome.jobId())
                .recordedAt(clock.instant())
                .build());
        } catch (RuntimeException e) {
            log.warn("Failed to record analytics for request {}: {}", outcome.requestId(), e.getMessage());
        }
    }

    public List<RouteStats> summarizeSince(Duration window) {
        return repository.summarizeByRoute(clock.instant().minus(window));
    }

    /**
     * @return number of rows removed
     */
    public int trimOlderThan(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int removed = repository.deleteRecordedBefore(cutoff);
        if (removed > 0) {
            log.info("Trimmed {} request analytics rows older than {}", removed, cutoff);
        }
        return removed;
    }

    private static String truncate(String error) {
        return error == null || error.length() <= 2000 ? error : error.substring(0, 2000);
    }
}
