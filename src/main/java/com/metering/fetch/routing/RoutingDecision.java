package com.metering.fetch.routing;

import com.metering.fetch.domain.RouteType;

/**
 * Route picked for a request together with the estimate that drove it.
 */
public record RoutingDecision(RouteType route, long estimatedSamples, boolean overridden) {
}
