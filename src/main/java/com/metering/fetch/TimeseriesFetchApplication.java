package com.metering.fetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Timeseries Fetch Service
 *
 * Serves raw metering samples from a paginated upstream API, choosing per request
 * between an inline fetch, a cache-backed fetch and a queued background job.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class TimeseriesFetchApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeseriesFetchApplication.class, args);
    }
}
