package com.metering.fetch.dlq;

import com.metering.fetch.domain.ErrorCategory;

import java.time.Instant;

public record FailureSummary(
    String jobId,
    String site,
    int pointsCount,
    String error,
    ErrorCategory errorCategory,
    int retryCount,
    Instant createdAt,
    Instant failedAt
) {
}
