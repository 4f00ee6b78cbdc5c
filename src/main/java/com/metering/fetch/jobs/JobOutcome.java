package com.metering.fetch.jobs;

/**
 * Result of handling one job delivery.
 */
public enum JobOutcome {
    COMPLETED,
    RETRYING,
    FAILED,
    /** Nothing to do: job unknown, already terminal, or cancelled mid-flight. */
    SKIPPED
}
