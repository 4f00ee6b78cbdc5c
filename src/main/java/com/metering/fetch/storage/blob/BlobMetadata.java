package com.metering.fetch.storage.blob;

import java.util.Map;

/**
 * HTTP-style metadata stored alongside an object.
 *
 * Custom metadata keys should be lowercase with hyphens; S3-compatible stores
 * lowercase them on the way back.
 */
public record BlobMetadata(String contentType, String contentEncoding, Map<String, String> customMetadata) {

    public BlobMetadata {
        customMetadata = customMetadata == null ? Map.of() : Map.copyOf(customMetadata);
    }

    public String custom(String key) {
        return customMetadata.get(key);
    }
}
