package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;

/**
 * Object cache read or write failure. Callers on the request path treat it as a miss.
 */
public class CacheException extends FetchException {

    public CacheException(String message, Throwable cause) {
        super(message, ErrorCategory.TRANSIENT, cause);
    }
}
