package com.metering.fetch.upstream;

/**
 * Fetches a single page from the upstream metering API.
 * Implementations raise {@link com.metering.fetch.exception.UpstreamException} on failure.
 */
public interface UpstreamClient {

    UpstreamPage fetchPage(PageQuery query);
}
