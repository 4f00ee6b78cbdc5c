package com.metering.fetch.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.metering.fetch.domain.PointSeries;

import java.util.Map;

/**
 * Inline result, serialized as {@code {data, _meta}}.
 */
public record DataResponse(
    @JsonProperty("data") Map<String, PointSeries> data,
    @JsonProperty("_meta") ResponseMeta meta
) implements FetchResponse {
}
