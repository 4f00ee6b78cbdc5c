package com.metering.fetch.analytics;

import java.util.Map;

/**
 * Destination for named operational data points.
 */
public interface AnalyticsSink {

    void writeDataPoint(String event, Map<String, String> tags, Map<String, Double> values);

    /**
     * High-severity event that needs operator attention.
     */
    void critical(String event, Map<String, String> context);
}
