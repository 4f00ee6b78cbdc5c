package com.metering.fetch.storage.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Queryable mirror of cache object metadata, plus hit tracking.
 */
@Entity
@Table(
    name = "cache_metadata",
    indexes = {
        @Index(name = "idx_cache_metadata_site", columnList = "site"),
        @Index(name = "idx_cache_metadata_expires", columnList = "expires_at")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheMetadataEntity {

    @Id
    @Column(name = "cache_key", length = 512)
    private String cacheKey;

    @Column(length = 200)
    private String site;

    @Column(name = "points_count")
    private int pointsCount;

    @Column(name = "samples_count")
    private long samplesCount;

    @Column(name = "original_size")
    private long originalSize;

    @Column(name = "compressed_size")
    private long compressedSize;

    @Column(name = "compression_ratio")
    private double compressionRatio;

    @Column(name = "hit_count", nullable = false)
    private long hitCount;

    @Column(name = "last_accessed")
    private Instant lastAccessed;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;
}
