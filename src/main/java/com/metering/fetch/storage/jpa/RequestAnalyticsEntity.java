package com.metering.fetch.storage.jpa;

import com.metering.fetch.domain.RouteType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per fetch request, success or failure.
 */
@Entity
@Table(
    name = "request_analytics",
    indexes = {
        @Index(name = "idx_request_analytics_recorded", columnList = "recorded_at"),
        @Index(name = "idx_request_analytics_route", columnList = "route_type, recorded_at")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestAnalyticsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false, length = 64)
    private String requestId;

    @Column(length = 200)
    private String site;

    @Column(name = "points_count")
    private int pointsCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "route_type", length = 10)
    private RouteType routeType;

    @Column(name = "cache_hit", nullable = false)
    private boolean cacheHit;

    @Column(name = "estimated_size")
    private long estimatedSize;

    @Column(name = "duration_ms")
    private long durationMs;

    @Column(nullable = false)
    private boolean success;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "job_id", length = 100)
    private String jobId;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
