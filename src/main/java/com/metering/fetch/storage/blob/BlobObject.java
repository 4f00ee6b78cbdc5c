package com.metering.fetch.storage.blob;

/**
 * Stored object body plus its metadata.
 */
public record BlobObject(String key, byte[] body, BlobMetadata metadata) {

    public long size() {
        return body == null ? 0 : body.length;
    }
}
