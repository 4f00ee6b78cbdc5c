package com.metering.fetch.upstream;

import java.time.Instant;
import java.util.List;

/**
 * One page request against the upstream paginated endpoint.
 *
 * @param cursor opaque continuation token, {@code null} for the first page
 */
public record PageQuery(String site, Instant start, Instant end, List<String> pointNames, String cursor, int pageSize) {

    public PageQuery {
        pointNames = pointNames == null ? List.of() : List.copyOf(pointNames);
    }

    public PageQuery withCursor(String nextCursor) {
        return new PageQuery(site, start, end, pointNames, nextCursor, pageSize);
    }
}
