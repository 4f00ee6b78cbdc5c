package com.metering.fetch.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheKeys Tests")
class CacheKeysTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2025-01-03T00:00:00Z");

    @Test
    @DisplayName("Should build a browsable key with dates and a content hash")
    void testKeyShape() {
        String key = CacheKeys.forRequest("site-1", List.of("a", "b"), START, END, "json");

        assertThat(key).matches("timeseries/site-1/2025-01-01_2025-01-03/[0-9a-f]{16}\\.json");
    }

    @Test
    @DisplayName("Should ignore point order and duplicates")
    void testPointOrder() {
        assertThat(CacheKeys.forRequest("site-1", List.of("b", "a", "a"), START, END, "json"))
            .isEqualTo(CacheKeys.forRequest("site-1", List.of("a", "b"), START, END, "json"));
        assertThat(CacheKeys.requestHash("site-1", List.of("b", "a"), START, END))
            .isEqualTo(CacheKeys.requestHash("site-1", List.of("a", "b"), START, END));
    }

    @Test
    @DisplayName("Should distinguish ranges that fall on the same dates")
    void testSameDateDifferentTimes() {
        String morning = CacheKeys.forRequest("site-1", List.of("a"), START, START.plusSeconds(3_600), "json");
        String evening = CacheKeys.forRequest("site-1", List.of("a"), START, START.plusSeconds(7_200), "json");

        assertThat(morning).isNotEqualTo(evening);
    }

    @Test
    @DisplayName("Should distinguish sites in the request hash")
    void testSiteInHash() {
        assertThat(CacheKeys.requestHash("site-1", List.of("a"), START, END))
            .isNotEqualTo(CacheKeys.requestHash("site-2", List.of("a"), START, END));
    }

    @Test
    @DisplayName("Should encode unsafe site characters and default the format")
    void testEncodingAndDefaultFormat() {
        String key = CacheKeys.forRequest("plant 7/north", List.of("a"), START, END, null);

        assertThat(key).startsWith("timeseries/plant+7%2Fnorth/").endsWith(".json");
    }
}
