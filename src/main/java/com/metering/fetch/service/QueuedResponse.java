package com.metering.fetch.service;

/**
 * Handle returned for deferred requests.
 *
 * @param pollInterval suggested polling period in milliseconds
 */
public record QueuedResponse(
    String status,
    String jobId,
    String statusUrl,
    long pollInterval,
    String message,
    String requestId
) implements FetchResponse {
}
