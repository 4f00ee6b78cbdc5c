package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;

public class JobResultExpiredException extends FetchException {

    public JobResultExpiredException(String jobId) {
        super("Result of job " + jobId + " has expired from the cache", ErrorCategory.CLIENT_FAULT);
    }
}
