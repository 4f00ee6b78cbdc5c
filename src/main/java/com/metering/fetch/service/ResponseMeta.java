package com.metering.fetch.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.metering.fetch.domain.RouteType;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseMeta(
    String requestId,
    RouteType routeType,
    boolean cacheHit,
    long duration,
    Instant timestamp,
    boolean truncated,
    long estimatedSize,
    String jobId
) {
}
