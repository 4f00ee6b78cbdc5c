package com.metering.fetch.api;

import com.metering.fetch.domain.JobPriority;
import com.metering.fetch.domain.RouteType;
import com.metering.fetch.exception.InvalidRequestException;
import com.metering.fetch.service.DataResponse;
import com.metering.fetch.service.FetchRequest;
import com.metering.fetch.service.FetchResponse;
import com.metering.fetch.service.QueuedResponse;
import com.metering.fetch.service.TimeseriesFetchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for fetching raw time-series samples.
 */
@RestController
@Validated
@Tag(name = "Timeseries", description = "Raw time-series fetch with adaptive routing")
public class TimeseriesController {

    private final TimeseriesFetchService fetchService;

    public TimeseriesController(TimeseriesFetchService fetchService) {
        this.fetchService = fetchService;
    }

    /**
     * GET /timeseries
     *
     * Small and medium requests are answered inline with 200; large ones are accepted
     * with 202 and a job handle to poll.
     */
    @Operation(
        summary = "Fetch raw samples for a set of points",
        description = """
            Estimates the result size from the number of points and the length of the
            time range, then picks a route:

            - **direct**: fetched synchronously from the upstream API
            - **cached**: served from the object cache, fetched and cached on a miss
            - **queued**: accepted with `202`; poll `statusUrl` until the job completes

            The `route` parameter forces a route regardless of the estimate.

            **Example Request:**
            ```
            GET /timeseries?site=plant-7&points=meter.kw,meter.kvar&start_time=2025-01-01T00:00:00Z&end_time=2025-01-02T00:00:00Z
            ```
            """,
        tags = {"Timeseries"}
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Data returned inline (direct or cached route)",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = DataResponse.class),
                examples = @ExampleObject(
                    name = "Inline Response",
                    value = """
                        {
                          "data": {
                            "meter.kw": {
                              "samples": [
                                {"time": "2025-01-01T00:00:00Z", "value": 41.5},
                                {"time": "2025-01-01T00:15:00Z", "value": 42.0}
                              ],
                              "count": 2
                            }
                          },
                          "_meta": {
                            "requestId": "req_5f0c2d8e9b1a4c7d8e6f0a1b2c3d4e5f",
                            "routeType": "direct",
                            "cacheHit": false,
                            "duration": 184,
                            "timestamp": "2025-01-02T09:12:44Z",
                            "truncated": false,
                            "estimatedSize": 200
                          }
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "202",
            description = "Request queued as a background job",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = QueuedResponse.class),
                examples = @ExampleObject(
                    name = "Queued Response",
                    value = """
                        {
                          "status": "queued",
                          "jobId": "job_3fa1c2d4e5b6a7980f1e2d3c_1735808400000",
                          "statusUrl": "/jobs/job_3fa1c2d4e5b6a7980f1e2d3c_1735808400000",
                          "pollInterval": 5000,
                          "message": "Your request is queued and will be processed shortly.",
                          "requestId": "req_5f0c2d8e9b1a4c7d8e6f0a1b2c3d4e5f"
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Missing or malformed parameters",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "502",
            description = "Upstream API returned an error",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "The request could not be queued",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "504",
            description = "Upstream fetch exceeded the deadline",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/timeseries")
    public ResponseEntity<FetchResponse> getTimeseries(
            @Parameter(description = "Site identifier", example = "plant-7", required = true)
            @RequestParam("site") @NotBlank String site,

            @Parameter(description = "Comma-separated point names", example = "meter.kw,meter.kvar", required = true)
            @RequestParam("points") @NotBlank String points,

            @Parameter(description = "Range start, ISO-8601 instant or date", example = "2025-01-01T00:00:00Z", required = true)
            @RequestParam("start_time") String startTime,

            @Parameter(description = "Range end, ISO-8601 instant or date", example = "2025-01-02T00:00:00Z", required = true)
            @RequestParam("end_time") String endTime,

            @Parameter(description = "Caller identity, used for failure notifications")
            @RequestParam(value = "user_id", required = false) String userId,

            @Parameter(description = "Force a route: direct, cached or queued")
            @RequestParam(value = "route", required = false) String route,

            @Parameter(description = "Output format of cached results", example = "json")
            @RequestParam(value = "format", required = false) String format,

            @Parameter(description = "Queue priority: low, normal or high")
            @RequestParam(value = "priority", required = false) String priority,

            @Parameter(description = "Deadline for synchronous routes in milliseconds")
            @RequestParam(value = "timeout_ms", required = false) @Positive Long timeoutMs) {

        FetchRequest request = new FetchRequest(
            site.trim(),
            parsePoints(points),
            parseInstant("start_time", startTime),
            parseInstant("end_time", endTime),
            userId,
            route == null || route.isBlank() ? null : RouteType.fromWireName(route),
            format,
            JobPriority.fromWireName(priority),
            timeoutMs == null ? null : Duration.ofMillis(timeoutMs)
        );

        FetchResponse response = fetchService.fetchTimeseries(request);
        HttpStatus status = response instanceof QueuedResponse ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    static List<String> parsePoints(String points) {
        return Arrays.stream(points.split(","))
            .map(String::trim)
            .filter(p -> !p.isEmpty())
            .distinct()
            .collect(Collectors.toList());
    }

    static Instant parseInstant(String name, String value) {
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(
                String.format("%s must be an ISO-8601 instant or date, got '%s'", name, value));
        }
    }
}
