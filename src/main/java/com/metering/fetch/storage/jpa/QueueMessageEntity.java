package com.metering.fetch.storage.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Message row for the database-backed queue transport.
 */
@Entity
@Table(
    name = "queue_messages",
    indexes = {
        @Index(name = "idx_queue_messages_visible", columnList = "queue_name, visible_at")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueMessageEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "queue_name", nullable = false, length = 100)
    private String queueName;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "priority_rank", nullable = false)
    private int priorityRank;

    @Column(name = "visible_at", nullable = false)
    private Instant visibleAt;

    /** Number of times the message has been handed to a consumer. */
    @Column(name = "receive_count", nullable = false)
    private int receiveCount;

    @Column(name = "receipt_handle", length = 64)
    private String receiptHandle;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
