package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;

public class UpstreamTimeoutException extends UpstreamException {

    public UpstreamTimeoutException(String message) {
        super(message, ErrorCategory.TRANSIENT, 0);
    }

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, ErrorCategory.TRANSIENT, cause);
    }
}
