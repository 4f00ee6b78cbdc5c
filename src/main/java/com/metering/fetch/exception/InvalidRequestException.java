package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;

public class InvalidRequestException extends FetchException {

    public InvalidRequestException(String message) {
        super(message, ErrorCategory.CLIENT_FAULT);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, ErrorCategory.CLIENT_FAULT, cause);
    }
}
