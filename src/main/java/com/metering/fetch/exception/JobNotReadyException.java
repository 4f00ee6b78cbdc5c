package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.domain.JobStatus;

public class JobNotReadyException extends FetchException {

    private final JobStatus status;

    public JobNotReadyException(String jobId, JobStatus status) {
        super(String.format("Job %s is %s; data is only available once completed", jobId, status.wireName()),
            ErrorCategory.CLIENT_FAULT);
        this.status = status;
    }

    public JobStatus getStatus() {
        return status;
    }
}
