package com.metering.fetch.storage.jpa;

import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.domain.JobPriority;
import com.metering.fetch.domain.JobStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Durable record of one queued fetch job.
 *
 * Status changes go through the conditional updates in {@link QueueJobJpaRepository},
 * never through a read-modify-save of this entity.
 */
@Entity
@Table(
    name = "queue_jobs",
    indexes = {
        @Index(name = "idx_queue_jobs_status", columnList = "status"),
        @Index(name = "idx_queue_jobs_request_hash", columnList = "request_hash, created_at DESC"),
        @Index(name = "idx_queue_jobs_created", columnList = "created_at")
    },
    uniqueConstraints = @UniqueConstraint(name = "uq_queue_jobs_active_request", columnNames = "active_request_hash")
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueJobEntity {

    /**
     * Format: job_{requestHash}_{epochMillis}
     */
    @Id
    @Column(name = "job_id", length = 100)
    private String jobId;

    @Column(name = "request_hash", nullable = false, length = 64)
    private String requestHash;

    /**
     * Equal to {@code requestHash} while the job is queued, processing or retrying and
     * NULL once it is terminal, so at most one active job exists per request.
     */
    @Column(name = "active_request_hash", length = 64)
    private String activeRequestHash;

    @Column(nullable = false, length = 200)
    private String site;

    @Convert(converter = PointListConverter.class)
    @Column(name = "points", nullable = false, columnDefinition = "TEXT")
    private List<String> points;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "user_id", length = 200)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private JobPriority priority;

    @Column(name = "output_format", length = 20)
    private String outputFormat;

    @Column(name = "persist_to_cache", nullable = false)
    private boolean persistToCache;

    /** 0-100, never decreases while the job is processing. */
    @Column(nullable = false)
    private int progress;

    @Column(name = "processed_points", nullable = false)
    private int processedPoints;

    @Column(name = "total_points", nullable = false)
    private int totalPoints;

    @Column(name = "estimated_size", nullable = false)
    private long estimatedSize;

    @Column(name = "samples_count")
    private Long samplesCount;

    @Column(name = "data_size")
    private Long dataSize;

    @Column(name = "cache_key", length = 512)
    private String cacheKey;

    @Column(nullable = false)
    private boolean truncated;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_category", length = 20)
    private ErrorCategory errorCategory;

    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;
}
