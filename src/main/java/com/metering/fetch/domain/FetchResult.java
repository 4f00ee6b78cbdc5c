package com.metering.fetch.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a complete paginated fetch.
 *
 * @param data         samples grouped per requested point, only points that returned data
 * @param pagesFetched number of upstream pages consumed
 * @param truncated    true when the page ceiling stopped pagination while more data was available
 */
public record FetchResult(Map<String, PointSeries> data, int pagesFetched, boolean truncated) {

    public FetchResult {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public long samplesCount() {
        return data.values().stream().mapToLong(PointSeries::count).sum();
    }
}
