package com.metering.fetch.routing;

import com.metering.fetch.domain.RouteType;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure size-based routing.
 *
 * The estimate is {@code pointCount * days * samplesPerDay}, rounded to the nearest
 * integer, where days may be fractional. Estimates strictly below the small threshold
 * go direct, estimates strictly below the large threshold go through the cache, and
 * everything else is queued. An explicit override always wins.
 */
public class RequestRouter {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final long samplesPerDay;
    private final long smallThreshold;
    private final long largeThreshold;

    public RequestRouter(long samplesPerDay, long smallThreshold, long largeThreshold) {
        if (samplesPerDay <= 0) {
            throw new IllegalArgumentException("samplesPerDay must be positive");
        }
        if (smallThreshold < 0 || largeThreshold < smallThreshold) {
            throw new IllegalArgumentException(
                String.format("Invalid thresholds: small=%d, large=%d", smallThreshold, largeThreshold));
        }
        this.samplesPerDay = samplesPerDay;
        this.smallThreshold = smallThreshold;
        this.largeThreshold = largeThreshold;
    }

    public long estimateSamples(int pointCount, Instant start, Instant end) {
        if (pointCount <= 0 || start == null || end == null || !end.isAfter(start)) {
            return 0L;
        }
        double days = Duration.between(start, end).toMillis() / MILLIS_PER_DAY;
        return Math.round(pointCount * days * samplesPerDay);
    }

    public RouteType routeFor(long estimatedSamples) {
        if (estimatedSamples < smallThreshold) {
            return RouteType.DIRECT;
        }
        if (estimatedSamples < largeThreshold) {
            return RouteType.CACHED;
        }
        return RouteType.QUEUED;
    }

    /**
     * @param override caller-forced route, or {@code null} to decide by size
     */
    public RoutingDecision decide(int pointCount, Instant start, Instant end, RouteType override) {
        long estimate = estimateSamples(pointCount, start, end);
        if (override != null) {
            return new RoutingDecision(override, estimate, true);
        }
        return new RoutingDecision(routeFor(estimate), estimate, false);
    }

    public long getSmallThreshold() {
        return smallThreshold;
    }

    public long getLargeThreshold() {
        return largeThreshold;
    }
}
