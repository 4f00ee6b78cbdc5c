package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;

import java.util.Set;

/**
 * Failure reported by, or while talking to, the upstream metering API.
 */
public class UpstreamException extends FetchException {

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 425, 429, 502, 503, 504);

    private final int statusCode;

    public UpstreamException(String message, ErrorCategory category, int statusCode) {
        super(message, category);
        this.statusCode = statusCode;
    }

    public UpstreamException(String message, ErrorCategory category, Throwable cause) {
        super(message, category, cause);
        this.statusCode = 0;
    }

    /**
     * Build an exception for a non-success upstream response.
     */
    public static UpstreamException forStatus(int statusCode, String reason) {
        String message = String.format("Upstream API error: %d %s", statusCode, reason == null ? "" : reason).trim();
        return new UpstreamException(message, categoryOf(statusCode), statusCode);
    }

    public static ErrorCategory categoryOf(int statusCode) {
        if (TRANSIENT_STATUSES.contains(statusCode)) {
            return ErrorCategory.TRANSIENT;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return ErrorCategory.CLIENT_FAULT;
        }
        if (statusCode >= 500) {
            return ErrorCategory.SERVER_FAULT;
        }
        return ErrorCategory.UNKNOWN;
    }

    /** HTTP status returned by the upstream, or 0 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
