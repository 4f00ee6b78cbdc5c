package com.metering.fetch.analytics;

import com.metering.fetch.domain.RouteType;

/**
 * What happened to one fetch request, as written to {@code request_analytics}.
 */
public record RequestOutcome(
    String requestId,
    String site,
    int pointsCount,
    RouteType route,
    boolean cacheHit,
    long estimatedSize,
    long durationMs,
    boolean success,
    String error,
    String jobId
) {
}
