package com.metering.fetch.service;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Map;

/**
 * Per-dependency health. {@code status} is {@code ok} only when every component is.
 */
public record HealthReport(String status, Instant timestamp, Map<String, ComponentHealth> components) {

    @JsonIgnore
    public boolean isHealthy() {
        return "ok".equals(status);
    }

    public record ComponentHealth(String status, String detail) {

        public static ComponentHealth up(String detail) {
            return new ComponentHealth("ok", detail);
        }

        public static ComponentHealth down(String detail) {
            return new ComponentHealth("down", detail);
        }
    }
}
