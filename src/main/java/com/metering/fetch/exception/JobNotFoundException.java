package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;

public class JobNotFoundException extends FetchException {

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId, ErrorCategory.CLIENT_FAULT);
    }
}
