package com.metering.fetch.exception;

import com.metering.fetch.domain.ErrorCategory;

/**
 * A job exhausted its attempts, or failed with a non-retryable error.
 */
public class JobTerminalFailureException extends FetchException {

    private final String jobId;
    private final int retryCount;

    public JobTerminalFailureException(String jobId, int retryCount, FetchException cause) {
        super(cause.getMessage(), cause.getCategory(), cause);
        this.jobId = jobId;
        this.retryCount = retryCount;
    }

    public String getJobId() {
        return jobId;
    }

    public int getRetryCount() {
        return retryCount;
    }
}
