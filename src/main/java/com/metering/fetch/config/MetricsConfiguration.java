package com.metering.fetch.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration for request, upstream and job timers.
 *
 * All meters carry {@code application} and {@code environment} tags. Timers under the
 * {@code fetch.} prefix publish p50/p95/p99 and a Prometheus histogram with SLO buckets
 * sized for upstream calls (tens of milliseconds up to the ten minute job timeout).
 */
@Configuration
public class MetricsConfiguration {

    static final String METER_PREFIX = "fetch.";

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "timeseries-fetch-service",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER || !id.getName().startsWith(METER_PREFIX)) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        .serviceLevelObjectives(
                            Duration.ofMillis(50).toNanos(),
                            Duration.ofMillis(250).toNanos(),
                            Duration.ofSeconds(1).toNanos(),
                            Duration.ofSeconds(5).toNanos(),
                            Duration.ofSeconds(30).toNanos(),   // direct route timeout
                            Duration.ofMinutes(2).toNanos(),
                            Duration.ofMinutes(10).toNanos()    // job timeout
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofMinutes(2))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
