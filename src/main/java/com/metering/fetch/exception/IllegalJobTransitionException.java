package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.domain.JobStatus;

public class IllegalJobTransitionException extends FetchException {

    public IllegalJobTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(String.format("Job %s cannot move from %s to %s", jobId, from, to), ErrorCategory.SERVER_FAULT);
    }
}
