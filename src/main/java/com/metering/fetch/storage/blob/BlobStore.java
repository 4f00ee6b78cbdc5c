package com.metering.fetch.storage.blob;

import java.util.Optional;

/**
 * Minimal object storage capability used by the cache and the dead-letter diagnostics.
 * Implementations raise unchecked exceptions on backend failures.
 */
public interface BlobStore {

    Optional<BlobObject> get(String key);

    Optional<BlobSummary> head(String key);

    void put(String key, byte[] body, BlobMetadata metadata);

    void delete(String key);

    /**
     * @param cursor continuation returned by a previous call, or {@code null}
     * @param limit  maximum entries in the returned page
     */
    BlobListing list(String prefix, String cursor, int limit);

    /** Cheap reachability probe for health reporting. */
    boolean isHealthy();
}
