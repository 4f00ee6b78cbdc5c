package com.metering.fetch.cache;

import com.metering.fetch.exception.CacheException;
import com.metering.fetch.storage.blob.BlobListing;
import com.metering.fetch.storage.blob.BlobMetadata;
import com.metering.fetch.storage.blob.BlobObject;
import com.metering.fetch.storage.blob.BlobStore;
import com.metering.fetch.storage.blob.BlobSummary;
import com.metering.fetch.storage.jpa.CacheMetadataEntity;
import com.metering.fetch.storage.jpa.CacheMetadataJpaRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Keyed payload cache on top of a {@link BlobStore}.
 *
 * Payloads are gzip-compressed when that makes them smaller. Entries older than
 * {@code maxCacheAge} are never returned: {@link #get} and {@link #exists} delete them on sight and
 * {@link #cleanup} sweeps the rest. Blob store failures surface as
 * {@link CacheException}; callers on the request path treat them as a miss.
 * The {@code cache_metadata} mirror is maintained best-effort.
 */
public class ObjectCacheStore {

    private static final Logger log = LoggerFactory.getLogger(ObjectCacheStore.class);

    public static final String META_POINTS_COUNT = "points-count";
    public static final String META_SAMPLES_COUNT = "samples-count";
    public static final String META_GENERATED_TIME = "generated-time";
    public static final String META_ORIGINAL_SIZE = "original-size";
    public static final String META_COMPRESSED_SIZE = "compressed-size";
    public static final String META_COMPRESSION_RATIO = "compression-ratio";
    public static final String META_SITE = "site";

    static final String ENCODING_GZIP = "gzip";
    static final String ENCODING_IDENTITY = "identity";
    private static final int LIST_PAGE_SIZE = 1000;

    private final BlobStore blobStore;
    private final CacheMetadataJpaRepository metadataRepository;
    private final Clock clock;
    private final boolean compressionEnabled;
    private final Duration maxCacheAge;

    private final Counter hits;
    private final Counter misses;
    private final Counter expired;
    private final Counter errors;

    public ObjectCacheStore(
            BlobStore blobStore,
            CacheMetadataJpaRepository metadataRepository,
            Clock clock,
            boolean compressionEnabled,
            Duration maxCacheAge,
            MeterRegistry meterRegistry) {
        this.blobStore = blobStore;
        this.metadataRepository = metadataRepository;
        this.clock = clock;
        this.compressionEnabled = compressionEnabled;
        this.maxCacheAge = maxCacheAge;
        this.hits = counter(meterRegistry, "hit");
        this.misses = counter(meterRegistry, "miss");
        this.expired = counter(meterRegistry, "expired");
        this.errors = counter(meterRegistry, "error");
    }

    /**
     * Store {@code payload} under {@code key}, replacing any previous entry.
     *
     * @return the number of bytes written to the blob store
     * @throws CacheException if the blob store rejects the write
     */
    public long put(String key, byte[] payload, String contentType, CacheEntryMetadata metadata) {
        Instant generatedAt = clock.instant();
        byte[] stored = payload;
        String encoding = ENCODING_IDENTITY;
        if (compressionEnabled) {
            byte[] compressed = gzip(payload);
            if (compressed.length < payload.length) {
                stored = compressed;
                encoding = ENCODING_GZIP;
            }
        }

        double ratio = payload.length == 0 ? 1.0 : (double) stored.length / payload.length;
        Map<String, String> custom = new HashMap<>(metadata.tags());
        custom.put(META_SITE, metadata.site() == null ? "" : metadata.site());
        custom.put(META_POINTS_COUNT, Integer.toString(metadata.pointsCount()));
        custom.put(META_SAMPLES_COUNT, Long.toString(metadata.samplesCount()));
        custom.put(META_GENERATED_TIME, generatedAt.toString());
        custom.put(META_ORIGINAL_SIZE, Integer.toString(payload.length));
        custom.put(META_COMPRESSED_SIZE, Integer.toString(stored.length));
        custom.put(META_COMPRESSION_RATIO, String.format(Locale.ROOT, "%.2f", ratio));

        try {
            blobStore.put(key, stored, new BlobMetadata(contentType, encoding, custom));
        } catch (RuntimeException e) {
            errors.increment();
            throw new CacheException("Failed to write cache entry " + key, e);
        }

        log.debug("Cached {} ({} -> {} bytes, {})", key, payload.length, stored.length, encoding);
        recordMetadata(key, metadata, payload.length, stored.length, ratio, generatedAt);
        return stored.length;
    }

    /**
     * @return the payload if present and fresh; stale entries are deleted and reported as absent
     * @throws CacheException if the blob store cannot be read
     */
    public Optional<CachedPayload> get(String key) {
        Optional<BlobObject> object;
        try {
            object = blobStore.get(key);
        } catch (RuntimeException e) {
            errors.increment();
            throw new CacheException("Failed to read cache entry " + key, e);
        }

        if (object.isEmpty()) {
            misses.increment();
            return Optional.empty();
        }

        BlobObject blob = object.get();
        Instant generatedAt = generatedAt(blob.metadata());
        if (isStale(generatedAt)) {
            expired.increment();
            log.debug("Cache entry {} expired (generated {})", key, generatedAt);
            evict(key);
            return Optional.empty();
        }

        byte[] payload = ENCODING_GZIP.equalsIgnoreCase(blob.metadata().contentEncoding())
            ? gunzip(blob.body(), key)
            : blob.body();

        hits.increment();
        recordHit(key);
        return Optional.of(new CachedPayload(key, payload, blob.metadata().contentType(), generatedAt,
            blob.metadata().customMetadata()));
    }

    /**
     * Existence check that applies the same staleness rule as {@link #get} without reading the body.
     * Stale entries are deleted. A blob store failure is logged and reported as absent.
     */
    public boolean exists(String key) {
        Optional<BlobSummary> summary;
        try {
            summary = blobStore.head(key);
        } catch (RuntimeException e) {
            errors.increment();
            log.warn("Failed to check cache entry {}: {}", key, e.getMessage());
            return false;
        }

        if (summary.isEmpty()) {
            return false;
        }
        Instant generatedAt = generatedAt(summary.get().metadata());
        if (isStale(generatedAt)) {
            expired.increment();
            log.debug("Cache entry {} expired (generated {})", key, generatedAt);
            evict(key);
            return false;
        }
        return true;
    }

    public void delete(String key) {
        try {
            blobStore.delete(key);
        } catch (RuntimeException e) {
            errors.increment();
            throw new CacheException("Failed to delete cache entry " + key, e);
        }
        deleteMetadata(key);
    }

    public int cleanup() {
        return cleanup(maxCacheAge);
    }

    /**
     * Delete every entry under the cache prefix generated more than {@code maxAge} ago.
     *
     * @return number of entries deleted
     */
    public int cleanup(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int deleted = 0;
        String cursor = null;
        do {
            BlobListing listing = blobStore.list(CacheKeys.PREFIX, cursor, LIST_PAGE_SIZE);
            for (BlobSummary summary : listing.objects()) {
                BlobMetadata metadata = summary.metadata() != null
                    ? summary.metadata()
                    : blobStore.head(summary.key()).map(BlobSummary::metadata).orElse(null);
                if (metadata == null) {
                    continue;
                }
                Instant generatedAt = generatedAt(metadata);
                if (generatedAt == null || generatedAt.isBefore(cutoff)) {
                    evict(summary.key());
                    deleted++;
                }
            }
            cursor = listing.nextCursor();
        } while (cursor != null);

        if (deleted > 0) {
            log.info("Cache cleanup removed {} entries older than {}", deleted, maxAge);
        }
        return deleted;
    }

    public CacheStats getStats() {
        long objects = 0;
        long totalSize = 0;
        Instant oldest = null;
        Instant newest = null;
        String cursor = null;
        do {
            BlobListing listing = blobStore.list(CacheKeys.PREFIX, cursor, LIST_PAGE_SIZE);
            for (BlobSummary summary : listing.objects()) {
                objects++;
                totalSize += summary.size();
                Instant modified = summary.lastModified();
                if (modified != null) {
                    oldest = oldest == null || modified.isBefore(oldest) ? modified : oldest;
                    newest = newest == null || modified.isAfter(newest) ? modified : newest;
                }
            }
            cursor = listing.nextCursor();
        } while (cursor != null);

        double sizeMb = Math.round(totalSize / 1024.0 / 1024.0 * 100.0) / 100.0;
        return new CacheStats(objects, totalSize, sizeMb, oldest, newest, totalHits());
    }

    /** Count a failure that happened outside this store, such as a rejected write-behind. */
    public void recordError() {
        errors.increment();
    }

    public Duration getMaxCacheAge() {
        return maxCacheAge;
    }

    private boolean isStale(Instant generatedAt) {
        // entries without a readable generation time are treated as expired
        return generatedAt == null || generatedAt.plus(maxCacheAge).isBefore(clock.instant());
    }

    private static Instant generatedAt(BlobMetadata metadata) {
        String value = metadata == null ? null : metadata.custom(META_GENERATED_TIME);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable {} '{}' on cache entry", META_GENERATED_TIME, value);
            return null;
        }
    }

    private void evict(String key) {
        try {
            blobStore.delete(key);
        } catch (RuntimeException e) {
            errors.increment();
            log.warn("Failed to delete expired cache entry {}: {}", key, e.getMessage());
        }
        deleteMetadata(key);
    }

    private void recordMetadata(String key, CacheEntryMetadata metadata, long originalSize, long storedSize,
                                double ratio, Instant generatedAt) {
        try {
            metadataRepository.save(CacheMetadataEntity.builder()
                .cacheKey(key)
                .site(metadata.site())
                .pointsCount(metadata.pointsCount())
                .samplesCount(metadata.samplesCount())
                .originalSize(originalSize)
                .compressedSize(storedSize)
                .compressionRatio(ratio)
                .hitCount(0)
                .createdAt(generatedAt)
                .expiresAt(generatedAt.plus(maxCacheAge))
                .build());
        } catch (RuntimeException e) {
            log.warn("Failed to record cache metadata for {}: {}", key, e.getMessage());
        }
    }

    private void recordHit(String key) {
        try {
            metadataRepository.recordHit(key, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Failed to record cache hit for {}: {}", key, e.getMessage());
        }
    }

    private void deleteMetadata(String key) {
        try {
            metadataRepository.deleteById(key);
        } catch (RuntimeException e) {
            log.warn("Failed to delete cache metadata for {}: {}", key, e.getMessage());
        }
    }

    private long totalHits() {
        try {
            return metadataRepository.totalHits();
        } catch (RuntimeException e) {
            log.warn("Failed to read cache hit totals: {}", e.getMessage());
            return 0L;
        }
    }

    private static byte[] gzip(byte[] payload) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(32, payload.length / 4));
        try (GZIPOutputStream out = new GZIPOutputStream(buffer)) {
            out.write(payload);
        } catch (IOException e) {
            throw new CacheException("Failed to compress cache payload", e);
        }
        return buffer.toByteArray();
    }

    private static byte[] gunzip(byte[] body, String key) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new CacheException("Corrupt compressed cache entry " + key, e);
        }
    }

    private static Counter counter(MeterRegistry registry, String result) {
        return Counter.builder("fetch.cache")
            .tag("result", result)
            .description("Object cache lookups by result")
            .register(registry);
    }
}
