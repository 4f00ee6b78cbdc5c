package com.metering.fetch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Execution strategy chosen for a fetch request.
 */
public enum RouteType {
    /** Synchronous upstream fetch, nothing persisted. */
    DIRECT,
    /** Synchronous fetch backed by the object cache. */
    CACHED,
    /** Deferred to the job queue; the caller polls for completion. */
    QUEUED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse the lowercase wire form used on the HTTP surface.
     *
     * @throws IllegalArgumentException if the value is not a known route
     */
    @JsonCreator
    public static RouteType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Route must not be blank");
        }
        for (RouteType type : values()) {
            if (type.wireName().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException(
            String.format("Unsupported route '%s'. Allowed: direct, cached, queued", value));
    }
}
