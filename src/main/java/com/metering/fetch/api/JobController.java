package com.metering.fetch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.metering.fetch.domain.JobStatus;
import com.metering.fetch.exception.JobNotFoundException;
import com.metering.fetch.jobs.JobSnapshot;
import com.metering.fetch.service.DataResponse;
import com.metering.fetch.service.TimeseriesFetchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Status, result download and cancellation of queued jobs.
 */
@RestController
@RequestMapping("/jobs")
@Tag(name = "Jobs", description = "Queued fetch jobs")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final TimeseriesFetchService fetchService;

    public JobController(TimeseriesFetchService fetchService) {
        this.fetchService = fetchService;
    }

    @Operation(summary = "Get job status",
        description = "Returns the job record with a status message. Completed jobs carry a `dataUrl`.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Job found"),
        @ApiResponse(responseCode = "404", description = "Unknown job",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{jobId}")
    public JobStatusResponse getJob(@PathVariable("jobId") String jobId) {
        JobSnapshot job = fetchService.getJobStatus(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        String dataUrl = job.status() == JobStatus.COMPLETED ? "/jobs/" + jobId + "/data" : null;
        return new JobStatusResponse(job, dataUrl);
    }

    @Operation(summary = "Download the result of a completed job")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Cached result"),
        @ApiResponse(responseCode = "404", description = "Unknown job"),
        @ApiResponse(responseCode = "409", description = "Job has not completed"),
        @ApiResponse(responseCode = "410", description = "Result no longer cached")
    })
    @GetMapping("/{jobId}/data")
    public DataResponse getJobData(@PathVariable("jobId") String jobId) {
        return fetchService.getJobData(jobId);
    }

    @Operation(summary = "Cancel a job",
        description = "Cancels a job that has not reached a terminal state. `cancelled` is false when it already had.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Cancellation result"),
        @ApiResponse(responseCode = "404", description = "Unknown job")
    })
    @DeleteMapping("/{jobId}")
    public CancelResponse cancelJob(@PathVariable("jobId") String jobId) {
        JobSnapshot job = fetchService.getJobStatus(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        boolean cancelled = fetchService.cancelJob(jobId);
        if (!cancelled) {
            log.info("Cancel of job {} ignored; status is {}", jobId, job.status().wireName());
        }
        JobStatus status = cancelled ? JobStatus.CANCELLED
            : fetchService.getJobStatus(jobId).map(JobSnapshot::status).orElse(job.status());
        return new CancelResponse(jobId, cancelled, status);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JobStatusResponse(@JsonUnwrapped JobSnapshot job, String dataUrl) {
    }

    public record CancelResponse(String jobId, boolean cancelled, JobStatus status) {
    }
}
