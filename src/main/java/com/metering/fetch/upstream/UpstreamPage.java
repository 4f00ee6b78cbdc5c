package com.metering.fetch.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire form of one upstream page.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpstreamPage(
    @JsonProperty("point_samples") List<UpstreamSample> pointSamples,
    @JsonProperty("next_cursor") String nextCursor,
    @JsonProperty("has_more") boolean hasMore
) {

    public UpstreamPage {
        pointSamples = pointSamples == null ? List.of() : pointSamples;
    }

    /** True only when the upstream says so and handed back a usable cursor. */
    public boolean continues() {
        return hasMore && nextCursor != null && !nextCursor.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UpstreamSample(String name, String time, double value) {
    }
}
