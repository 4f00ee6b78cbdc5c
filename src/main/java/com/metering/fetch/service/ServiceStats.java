package com.metering.fetch.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.metering.fetch.analytics.RouteStats;
import com.metering.fetch.cache.CacheStats;
import com.metering.fetch.domain.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceStats(
    Map<JobStatus, Long> jobs,
    long queueDepth,
    CacheStats cache,
    List<RouteStats> requestsLast24h,
    Instant timestamp
) {
}
