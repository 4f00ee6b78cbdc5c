package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;

public class QueueTransportException extends FetchException {

    public QueueTransportException(String message, Throwable cause) {
        super(message, ErrorCategory.SERVER_FAULT, cause);
    }
}
