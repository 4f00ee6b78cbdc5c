package com.metering.fetch.jobs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.domain.JobStatus;
import com.metering.fetch.storage.jpa.QueueJobEntity;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a job record, with a human-readable status message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSnapshot(
    String jobId,
    String requestHash,
    JobStatus status,
    String message,
    int progress,
    int processedPoints,
    int totalPoints,
    String site,
    List<String> points,
    Instant startTime,
    Instant endTime,
    String userId,
    long estimatedSize,
    int retryCount,
    String error,
    ErrorCategory errorCategory,
    String cacheKey,
    boolean truncated,
    Long samplesCount,
    Long dataSize,
    Long processingTimeMs,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant failedAt,
    Instant cancelledAt
) {

    public static JobSnapshot from(QueueJobEntity job) {
        return new JobSnapshot(
            job.getJobId(),
            job.getRequestHash(),
            job.getStatus(),
            messageFor(job.getStatus(), job.getProgress(), job.getRetryCount(), job.getErrorMessage()),
            job.getProgress(),
            job.getProcessedPoints(),
            job.getTotalPoints(),
            job.getSite(),
            job.getPoints(),
            job.getStartTime(),
            job.getEndTime(),
            job.getUserId(),
            job.getEstimatedSize(),
            job.getRetryCount(),
            job.getErrorMessage(),
            job.getErrorCategory(),
            job.getCacheKey(),
            job.isTruncated(),
            job.getSamplesCount(),
            job.getDataSize(),
            job.getProcessingTimeMs(),
            job.getCreatedAt(),
            job.getStartedAt(),
            job.getCompletedAt(),
            job.getFailedAt(),
            job.getCancelledAt()
        );
    }

    static String messageFor(JobStatus status, int progress, int retryCount, String error) {
        switch (status) {
            case QUEUED:
                return "Your request is queued and will be processed shortly.";
            case PROCESSING:
                return "Processing... " + progress + "% complete.";
            case COMPLETED:
                return "Your data is ready!";
            case FAILED:
                return "Request failed: " + (error == null ? "Unknown error" : error);
            case RETRYING:
                return "Retrying... (attempt " + (retryCount + 1) + ")";
            case CANCELLED:
                return "Request was cancelled.";
            default:
                return "Unknown status";
        }
    }
}
