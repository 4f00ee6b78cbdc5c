package com.metering.fetch.service;

import com.metering.fetch.domain.JobPriority;
import com.metering.fetch.domain.RouteType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A caller's request for raw samples.
 *
 * @param routeOverride forces a route when non-null
 * @param timeout       deadline for synchronous routes; {@code null} uses the configured default
 */
public record FetchRequest(
    String site,
    List<String> points,
    Instant startTime,
    Instant endTime,
    String userId,
    RouteType routeOverride,
    String format,
    JobPriority priority,
    Duration timeout
) {

    public FetchRequest {
        points = points == null ? List.of() : List.copyOf(points);
        format = format == null || format.isBlank() ? "json" : format;
        priority = priority == null ? JobPriority.NORMAL : priority;
    }

    public static FetchRequest of(String site, List<String> points, Instant startTime, Instant endTime) {
        return new FetchRequest(site, points, startTime, endTime, null, null, null, null, null);
    }
}
