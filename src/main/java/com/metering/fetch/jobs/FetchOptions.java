package com.metering.fetch.jobs;

import com.metering.fetch.domain.JobPriority;

/**
 * Per-job processing options.
 *
 * @param cacheKey where the result is written when {@code persistToCache} is set;
 *                 derived from the request when {@code null}
 */
public record FetchOptions(String format, boolean persistToCache, String cacheKey, JobPriority priority) {

    public FetchOptions {
        format = format == null || format.isBlank() ? "json" : format;
        priority = priority == null ? JobPriority.NORMAL : priority;
    }

    public static FetchOptions defaults() {
        return new FetchOptions("json", true, null, JobPriority.NORMAL);
    }
}
