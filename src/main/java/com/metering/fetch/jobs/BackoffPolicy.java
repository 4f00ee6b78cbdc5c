package com.metering.fetch.jobs;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(maxDelay, baseDelay * 2^retryCount)}.
 */
public class BackoffPolicy {

    private static final int MAX_SHIFT = 30;

    private final Duration baseDelay;
    private final Duration maxDelay;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay) {
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public Duration delayFor(int retryCount) {
        int shift = Math.min(Math.max(retryCount, 0), MAX_SHIFT);
        long millis;
        try {
            millis = Math.multiplyExact(baseDelay.toMillis(), 1L << shift);
        } catch (ArithmeticException e) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(millis);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
