package com.metering.fetch.storage.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(
    name = "user_notifications",
    indexes = {
        @Index(name = "idx_user_notifications_user", columnList = "user_id, created_at DESC")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserNotificationEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 200)
    private String userId;

    @Column(name = "notification_type", nullable = false, length = 40)
    private String notificationType;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(name = "message_text", nullable = false, length = 2000)
    private String messageText;

    @Column(name = "job_id", length = 100)
    private String jobId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "read_at")
    private Instant readAt;
}
