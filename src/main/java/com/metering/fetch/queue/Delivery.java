package com.metering.fetch.queue;

import java.time.Instant;

/**
 * A received message leased to one consumer.
 *
 * @param attempt 1-based delivery count kept by the transport; the authoritative retry counter
 */
public record Delivery<T>(String messageId, String receiptHandle, T body, int attempt, Instant firstEnqueuedAt) {

    public int retryCount() {
        return Math.max(0, attempt - 1);
    }
}
