package com.metering.fetch.domain;

/**
 * Coarse failure category assigned where an error originates.
 * Retry and dead-letter decisions are made on the category, not the message text.
 */
public enum ErrorCategory {
    /** Timeouts, throttling, temporarily unavailable dependencies. Worth retrying. */
    TRANSIENT,
    /** Bad input or missing resources on the caller's side. Never retried. */
    CLIENT_FAULT,
    /** Internal failures of a dependency or of this service. */
    SERVER_FAULT,
    /** Origin unknown, e.g. messages written by older producers. */
    UNKNOWN
}
