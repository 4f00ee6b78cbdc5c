package com.metering.fetch.analytics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * {@link AnalyticsSink} that records events as Micrometer meters and log lines.
 */
@Component
public class MeterAnalyticsSink implements AnalyticsSink {

    private static final Logger log = LoggerFactory.getLogger(MeterAnalyticsSink.class);

    private final MeterRegistry meterRegistry;

    public MeterAnalyticsSink(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void writeDataPoint(String event, Map<String, String> tags, Map<String, Double> values) {
        // meter tag sets stay fixed per name; free-form tags are only logged
        meterRegistry.counter("fetch.analytics.events", "event", event).increment();
        values.forEach((name, value) -> {
            if (value != null) {
                DistributionSummary.builder("fetch.analytics." + event + "." + name)
                    .register(meterRegistry)
                    .record(value);
            }
        });
        log.info("analytics event={} tags={} values={}", event, tags, values);
    }

    @Override
    public void critical(String event, Map<String, String> context) {
        Counter.builder("fetch.dlq.critical")
            .tag("event", event)
            .description("High-severity operational alerts")
            .register(meterRegistry)
            .increment();
        log.error("CRITICAL event={} context={}", event, context);
    }
}
