package com.metering.fetch.cache;

import java.util.Map;

/**
 * Caller-supplied description of a payload being cached.
 *
 * @param tags extra custom metadata, stored verbatim; use lowercase hyphenated keys
 */
public record CacheEntryMetadata(String site, int pointsCount, long samplesCount, Map<String, String> tags) {

    public CacheEntryMetadata {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }
}
