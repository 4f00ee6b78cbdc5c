package com.metering.fetch.analytics;

import com.metering.fetch.domain.RouteType;

/**
 * Request totals for one route over the reporting window.
 */
public record RouteStats(RouteType route, Long requests, Long cacheHits, Long successes, Double averageDurationMs) {

    public double successRate() {
        return requests == null || requests == 0 ? 0.0 : (double) successes / requests;
    }
}
