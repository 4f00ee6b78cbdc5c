package com.metering.fetch.cache;

import com.metering.fetch.exception.CacheException;
import com.metering.fetch.storage.blob.BlobMetadata;
import com.metering.fetch.storage.blob.BlobStore;
import com.metering.fetch.storage.blob.InMemoryBlobStore;
import com.metering.fetch.storage.jpa.CacheMetadataEntity;
import com.metering.fetch.storage.jpa.CacheMetadataJpaRepository;
import com.metering.fetch.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ObjectCacheStore Tests")
class ObjectCacheStoreTest {

    private static final String KEY = "timeseries/site-1/2025-01-01_2025-01-02/0123456789abcdef.json";
    private static final CacheEntryMetadata META = new CacheEntryMetadata("site-1", 2, 4, Map.of("truncated", "false"));

    private MutableClock clock;
    private InMemoryBlobStore blobStore;
    private CacheMetadataJpaRepository metadataRepository;
    private SimpleMeterRegistry meterRegistry;
    private ObjectCacheStore cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-02T00:00:00Z"));
        blobStore = new InMemoryBlobStore(clock);
        metadataRepository = mock(CacheMetadataJpaRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        cache = new ObjectCacheStore(blobStore, metadataRepository, clock, true, Duration.ofHours(24), meterRegistry);
    }

    private static byte[] repetitivePayload() {
        return "{\"a\":{\"samples\":[1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1,1]}}"
            .repeat(20).getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should return the original bytes of a compressed entry")
    void testRoundTripCompressed() {
        byte[] payload = repetitivePayload();

        long stored = cache.put(KEY, payload, "application/json", META);
        Optional<CachedPayload> hit = cache.get(KEY);

        assertThat(stored).isLessThan(payload.length);
        assertThat(blobStore.get(KEY)).get()
            .satisfies(blob -> assertThat(blob.metadata().contentEncoding()).isEqualTo("gzip"));
        assertThat(hit).get().satisfies(entry -> {
            assertThat(entry.payload()).isEqualTo(payload);
            assertThat(entry.contentType()).isEqualTo("application/json");
            assertThat(entry.tag("truncated")).isEqualTo("false");
            assertThat(entry.tag(ObjectCacheStore.META_SAMPLES_COUNT)).isEqualTo("4");
        });
    }

    @Test
    @DisplayName("Should store tiny payloads uncompressed")
    void testSkipsCompressionWhenLarger() {
        byte[] payload = "{}".getBytes(StandardCharsets.UTF_8);

        long stored = cache.put(KEY, payload, "application/json", META);

        assertThat(stored).isEqualTo(payload.length);
        assertThat(blobStore.get(KEY)).get()
            .satisfies(blob -> assertThat(blob.metadata().contentEncoding()).isEqualTo("identity"));
        assertThat(cache.get(KEY)).get().satisfies(entry -> assertThat(entry.payload()).isEqualTo(payload));
    }

    @Test
    @DisplayName("Should record a miss for an absent key")
    void testMiss() {
        assertThat(cache.get(KEY)).isEmpty();
        assertThat(meterRegistry.counter("fetch.cache", "result", "miss").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should delete and hide entries older than the maximum age")
    void testLazyExpiry() {
        cache.put(KEY, repetitivePayload(), "application/json", META);
        clock.advance(Duration.ofHours(25));

        assertThat(cache.exists(KEY)).isFalse();
        assertThat(cache.get(KEY)).isEmpty();
        assertThat(blobStore.size()).isZero();
        assertThat(meterRegistry.counter("fetch.cache", "result", "expired").count()).isEqualTo(1.0);
        verify(metadataRepository).deleteById(KEY);
    }

    @Test
    @DisplayName("Should delete a stale entry found by an existence check alone")
    void testExistsEvictsStaleEntry() {
        cache.put(KEY, repetitivePayload(), "application/json", META);
        clock.advance(Duration.ofHours(25));

        assertThat(cache.exists(KEY)).isFalse();
        assertThat(blobStore.size()).isZero();
        assertThat(meterRegistry.counter("fetch.cache", "result", "expired").count()).isEqualTo(1.0);
        verify(metadataRepository).deleteById(KEY);
    }

    @Test
    @DisplayName("Should keep entries exactly at the maximum age")
    void testBoundary() {
        cache.put(KEY, repetitivePayload(), "application/json", META);
        clock.advance(Duration.ofHours(24));

        assertThat(cache.exists(KEY)).isTrue();
        assertThat(cache.get(KEY)).isPresent();
    }

    @Test
    @DisplayName("Should treat entries without a generation time as expired")
    void testMissingGeneratedTime() {
        blobStore.put(KEY, new byte[] {1, 2, 3}, new BlobMetadata("application/json", "identity", Map.of()));

        assertThat(cache.get(KEY)).isEmpty();
        assertThat(blobStore.get(KEY)).isEmpty();
    }

    @Test
    @DisplayName("Should sweep only stale entries under the cache prefix")
    void testCleanup() {
        cache.put(KEY, repetitivePayload(), "application/json", META);
        clock.advance(Duration.ofHours(2));
        String fresh = KEY.replace("0123456789abcdef", "fedcba9876543210");
        cache.put(fresh, repetitivePayload(), "application/json", META);
        blobStore.put("dlq/failures/job_1.json", new byte[] {1}, new BlobMetadata("application/json", null, Map.of()));

        int deleted = cache.cleanup(Duration.ofHours(1));

        assertThat(deleted).isEqualTo(1);
        assertThat(blobStore.get(KEY)).isEmpty();
        assertThat(blobStore.get(fresh)).isPresent();
        assertThat(blobStore.get("dlq/failures/job_1.json")).isPresent();
    }

    @Test
    @DisplayName("Should report object count, size and age range")
    void testStats() {
        when(metadataRepository.totalHits()).thenReturn(7L);
        cache.put(KEY, repetitivePayload(), "application/json", META);
        clock.advance(Duration.ofMinutes(5));
        cache.put(KEY.replace("0123456789abcdef", "fedcba9876543210"), "{}".getBytes(StandardCharsets.UTF_8),
            "application/json", META);

        CacheStats stats = cache.getStats();

        assertThat(stats.totalObjects()).isEqualTo(2);
        assertThat(stats.totalSize()).isPositive();
        assertThat(stats.newestEntry()).isEqualTo(stats.oldestEntry().plus(Duration.ofMinutes(5)));
        assertThat(stats.totalHits()).isEqualTo(7L);
    }

    @Test
    @DisplayName("Should mirror writes into cache metadata")
    void testMetadataMirror() {
        cache.put(KEY, repetitivePayload(), "application/json", META);

        ArgumentCaptor<CacheMetadataEntity> captor = ArgumentCaptor.forClass(CacheMetadataEntity.class);
        verify(metadataRepository).save(captor.capture());
        assertThat(captor.getValue().getCacheKey()).isEqualTo(KEY);
        assertThat(captor.getValue().getSamplesCount()).isEqualTo(4);
        assertThat(captor.getValue().getExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
    }

    @Test
    @DisplayName("Should still serve hits when the metadata mirror fails")
    void testMetadataFailureIsBestEffort() {
        when(metadataRepository.save(any())).thenThrow(new IllegalStateException("db down"));
        doThrow(new IllegalStateException("db down")).when(metadataRepository).recordHit(anyString(), any());

        cache.put(KEY, repetitivePayload(), "application/json", META);

        assertThat(cache.get(KEY)).isPresent();
    }

    @Test
    @DisplayName("Should wrap blob store failures in CacheException")
    void testBlobFailure() {
        BlobStore failing = mock(BlobStore.class);
        when(failing.get(KEY)).thenThrow(new IllegalStateException("connection reset"));
        ObjectCacheStore broken = new ObjectCacheStore(failing, metadataRepository, clock, true,
            Duration.ofHours(24), meterRegistry);

        assertThatThrownBy(() -> broken.get(KEY))
            .isInstanceOf(CacheException.class)
            .hasRootCauseMessage("connection reset");
    }

    @Test
    @DisplayName("Should report an entry as absent when the existence check fails")
    void testExistsFailureIsMiss() {
        BlobStore failing = mock(BlobStore.class);
        when(failing.head(KEY)).thenThrow(new IllegalStateException("connection reset"));
        ObjectCacheStore broken = new ObjectCacheStore(failing, metadataRepository, clock, true,
            Duration.ofHours(24), meterRegistry);

        assertThat(broken.exists(KEY)).isFalse();
        assertThat(meterRegistry.counter("fetch.cache", "result", "error").count()).isEqualTo(1.0);
    }
}
