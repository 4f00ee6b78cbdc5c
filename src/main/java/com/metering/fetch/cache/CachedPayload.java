package com.metering.fetch.cache;

import java.time.Instant;
import java.util.Map;

/**
 * A fresh cache hit with the payload restored to its original bytes.
 */
public record CachedPayload(String key, byte[] payload, String contentType, Instant generatedAt,
                            Map<String, String> metadata) {

    public String tag(String name) {
        return metadata.get(name);
    }
}
