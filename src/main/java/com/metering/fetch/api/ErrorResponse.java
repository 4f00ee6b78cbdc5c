package com.metering.fetch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Uniform error body for every non-2xx response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "400")
    int status,

    @Schema(description = "Error type", example = "INVALID_REQUEST")
    String error,

    @Schema(description = "Human-readable error message", example = "site is required")
    String message,

    @Schema(description = "Request path that caused the error", example = "/timeseries")
    String path,

    @Schema(description = "Timestamp of the error", example = "2025-03-01T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Detailed validation errors (if applicable)")
    List<ValidationError> validationErrors
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path, List<ValidationError> validationErrors) {
        this(status, error, message, path, Instant.now(), validationErrors);
    }

    @Schema(description = "Field-level validation error")
    public record ValidationError(
        @Schema(description = "Parameter that failed validation", example = "start_time")
        String field,

        @Schema(description = "Rejected value", example = "yesterday")
        String rejectedValue,

        @Schema(description = "Validation error message", example = "Expected an ISO-8601 instant")
        String message
    ) {}
}
