package com.metering.fetch.dlq;

import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.jobs.FetchOptions;
import com.metering.fetch.jobs.JobMessage;
import com.metering.fetch.queue.DeadLetterReason;
import com.metering.fetch.queue.Delivery;

import java.time.Instant;
import java.util.List;

/**
 * Body of a message on the dead-letter queue: the original job plus the failure.
 */
public record DeadLetterMessage(
    String jobId,
    String site,
    List<String> points,
    Instant startTime,
    Instant endTime,
    String userId,
    FetchOptions options,
    String error,
    ErrorCategory category,
    int retryCount,
    String stackTrace,
    Instant failedAt
) {

    public DeadLetterMessage {
        points = points == null ? List.of() : List.copyOf(points);
        category = category == null ? ErrorCategory.UNKNOWN : category;
    }

    public static DeadLetterMessage from(Delivery<JobMessage> delivery, DeadLetterReason reason, Instant failedAt) {
        JobMessage job = delivery.body();
        return new DeadLetterMessage(job.jobId(), job.site(), job.points(), job.startTime(), job.endTime(),
            job.userId(), job.options(), reason.error(), reason.category(), delivery.retryCount(),
            reason.detail(), failedAt);
    }
}
