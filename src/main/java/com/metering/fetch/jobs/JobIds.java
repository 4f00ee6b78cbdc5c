package com.metering.fetch.jobs;

import java.time.Clock;

public final class JobIds {

    private JobIds() {
    }

    /**
     * Format: {@code job_{requestHash}_{epochMillis}}.
     */
    public static String newJobId(String requestHash, Clock clock) {
        return "job_" + requestHash + "_" + clock.millis();
    }
}
