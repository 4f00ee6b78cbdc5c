package com.metering.fetch.domain;

import java.util.List;

/**
 * All samples collected for one point, in upstream order.
 */
public record PointSeries(List<Sample> samples, int count) {

    public PointSeries {
        samples = samples == null ? List.of() : List.copyOf(samples);
        count = samples.size();
    }

    public static PointSeries of(List<Sample> samples) {
        return new PointSeries(samples, samples == null ? 0 : samples.size());
    }
}
