package com.metering.fetch.dlq;

public enum FailureClassification {
    /** Worth trying again later; a recovery record is created. */
    RECOVERABLE,
    /** Caused by the request itself; the user is notified. */
    USER_ERROR,
    /** Internal failure; operators are alerted. */
    SYSTEM_ERROR,
    /** Nothing matched; operators are alerted. */
    UNKNOWN
}
