package com.metering.fetch.api;

import com.metering.fetch.dlq.DeadLetterHandler;
import com.metering.fetch.dlq.DlqStats;
import com.metering.fetch.dlq.FailureSummary;
import com.metering.fetch.service.HealthReport;
import com.metering.fetch.service.ServiceStats;
import com.metering.fetch.service.TimeseriesFetchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operational endpoints: aggregate statistics, dead-letter inspection and recovery, health.
 */
@RestController
@Tag(name = "Operations", description = "Statistics, dead-letter queue and health")
public class OperationsController {

    private final TimeseriesFetchService fetchService;
    private final DeadLetterHandler deadLetterHandler;

    public OperationsController(TimeseriesFetchService fetchService, DeadLetterHandler deadLetterHandler) {
        this.fetchService = fetchService;
        this.deadLetterHandler = deadLetterHandler;
    }

    @Operation(summary = "Job, queue, cache and request statistics")
    @GetMapping("/stats")
    public ServiceStats getStats() {
        return fetchService.getStats();
    }

    @Operation(summary = "Dead-letter statistics")
    @GetMapping("/queue/dlq/stats")
    public DlqStats getDlqStats() {
        return deadLetterHandler.getStats();
    }

    @Operation(summary = "Most recent terminal failures")
    @GetMapping("/queue/dlq/failures")
    public FailureList getRecentFailures(
            @Parameter(description = "Maximum number of failures, 1 to 100")
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        List<FailureSummary> failures = deadLetterHandler.listRecentFailures(limit);
        return new FailureList(failures, failures.size());
    }

    @Operation(summary = "Requeue a dead-lettered job as a new job")
    @PostMapping("/queue/dlq/recovery/{jobId}/requeue")
    public RecoveryResponse requeue(@PathVariable("jobId") String jobId) {
        return deadLetterHandler.requeue(jobId)
            .map(newJobId -> new RecoveryResponse(jobId, true, newJobId))
            .orElseGet(() -> new RecoveryResponse(jobId, false, null));
    }

    @Operation(summary = "Abandon recovery of a dead-lettered job")
    @PostMapping("/queue/dlq/recovery/{jobId}/abandon")
    public RecoveryResponse abandon(@PathVariable("jobId") String jobId) {
        return new RecoveryResponse(jobId, deadLetterHandler.abandon(jobId), null);
    }

    /**
     * 200 when every dependency is up, 503 otherwise.
     */
    @Operation(summary = "Per-dependency health")
    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = fetchService.health();
        return ResponseEntity.status(report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
            .body(report);
    }

    public record FailureList(List<FailureSummary> failures, int count) {
    }

    public record RecoveryResponse(String jobId, boolean updated, String newJobId) {
    }
}
