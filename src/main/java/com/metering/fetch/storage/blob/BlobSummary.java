package com.metering.fetch.storage.blob;

import java.time.Instant;

/**
 * Listing entry. {@code metadata} may be {@code null} for backends whose listings do
 * not include custom metadata; callers fall back to {@link BlobStore#head(String)}.
 */
public record BlobSummary(String key, long size, Instant lastModified, BlobMetadata metadata) {
}
