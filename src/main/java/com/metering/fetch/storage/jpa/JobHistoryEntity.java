package com.metering.fetch.storage.jpa;

import com.metering.fetch.domain.JobStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Compact archive row for terminal jobs past their retention window.
 */
@Entity
@Table(
    name = "job_history",
    indexes = {
        @Index(name = "idx_job_history_site", columnList = "site, completed_at DESC")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 100)
    private String jobId;

    @Column(nullable = false, length = 200)
    private String site;

    @Column(name = "points_count", nullable = false)
    private int pointsCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "samples_count")
    private Long samplesCount;

    @Column(name = "data_size")
    private Long dataSize;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "archived_at", nullable = false)
    private Instant archivedAt;
}
