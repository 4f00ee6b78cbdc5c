package com.metering.fetch.storage.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Recovery candidate created for a recoverable dead-lettered job.
 * The unique constraint on {@code job_id} keeps redelivered DLQ messages from
 * producing a second record.
 */
@Entity
@Table(
    name = "dlq_recovery_queue",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_dlq_recovery_job", columnNames = {"job_id"})
    },
    indexes = {
        @Index(name = "idx_dlq_recovery_status", columnList = "status")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DlqRecoveryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 100)
    private String jobId;

    /** Serialized dead-letter message, replayed on requeue. */
    @Column(name = "original_message", nullable = false, columnDefinition = "TEXT")
    private String originalMessage;

    @Column(nullable = false, length = 20)
    private String classification;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RecoveryStatus status;

    @Column(name = "requeued_job_id", length = 100)
    private String requeuedJobId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;
}
