package com.metering.fetch.cache;

import java.time.Instant;

public record CacheStats(
    long totalObjects,
    long totalSize,
    double totalSizeMb,
    Instant oldestEntry,
    Instant newestEntry,
    long totalHits
) {
}
