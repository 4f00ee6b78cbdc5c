package com.metering.fetch.jobs;

import com.metering.fetch.cache.ObjectCacheStore;
import com.metering.fetch.dlq.DeadLetterHandler;
import com.metering.fetch.dlq.DeadLetterMessage;
import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.domain.JobStatus;
import com.metering.fetch.exception.InvalidRequestException;
import com.metering.fetch.exception.UpstreamException;
import com.metering.fetch.queue.Delivery;
import com.metering.fetch.queue.DurableQueue;
import com.metering.fetch.storage.jpa.DlqRecoveryJpaRepository;
import com.metering.fetch.storage.jpa.QueueJobJpaRepository;
import com.metering.fetch.storage.jpa.RecoveryStatus;
import com.metering.fetch.support.MutableClock;
import com.metering.fetch.support.ScriptedUpstreamClient;
import com.metering.fetch.support.TestUpstreamConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Import(TestUpstreamConfiguration.class)
@DisplayName("JobQueueManager Integration Tests")
class JobQueueManagerTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-04-10T00:00:00Z");
    private static final List<String> POINTS = List.of("p1", "p2", "p3");

    @Autowired
    private JobQueueManager jobQueueManager;

    @Autowired
    private DurableQueue<JobMessage> jobQueue;

    @Autowired
    private DurableQueue<DeadLetterMessage> deadLetterQueue;

    @Autowired
    private DeadLetterHandler deadLetterHandler;

    @Autowired
    private QueueJobJpaRepository jobs;

    @Autowired
    private DlqRecoveryJpaRepository recoveries;

    @Autowired
    private ObjectCacheStore cache;

    @Autowired
    private ScriptedUpstreamClient upstream;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        jobs.deleteAll();
        recoveries.deleteAll();
        jobQueue.purge();
        deadLetterQueue.purge();
        upstream.reset();
        clock.set(TestUpstreamConfiguration.START);
    }

    private String queue(String jobId) {
        return jobQueueManager.queueLargeRequest(jobId, "site-1", POINTS, START, END, "user-1",
            new FetchOptions("json", true, null, null));
    }

    private JobOutcome processNext() {
        List<Delivery<JobMessage>> deliveries = jobQueue.receive(1);
        assertThat(deliveries).as("a visible job message").hasSize(1);
        return jobQueueManager.processJob(deliveries.get(0));
    }

    private JobSnapshot status(String jobId) {
        return jobQueueManager.getJobStatus(jobId).orElseThrow();
    }

    @Test
    @DisplayName("Should persist a queued job and send its message")
    void testQueueLargeRequest() {
        queue("job_a");

        JobSnapshot job = status("job_a");
        assertThat(job.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.message()).isEqualTo("Your request is queued and will be processed shortly.");
        assertThat(job.estimatedSize()).isEqualTo(30_000);
        assertThat(job.totalPoints()).isEqualTo(3);
        assertThat(jobQueue.depth()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject malformed jobs before writing anything")
    void testValidation() {
        assertThatThrownBy(() -> jobQueueManager.queueLargeRequest("job_a", "site-1", List.of(), START, END, null, null))
            .isInstanceOf(InvalidRequestException.class);
        assertThat(jobs.count()).isZero();
        assertThat(jobQueue.depth()).isZero();
    }

    @Test
    @DisplayName("Should complete a job, cache its result and acknowledge the message")
    void testCompletion() {
        queue("job_a");

        assertThat(processNext()).isEqualTo(JobOutcome.COMPLETED);

        JobSnapshot job = status("job_a");
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.progress()).isEqualTo(100);
        assertThat(job.retryCount()).isZero();
        assertThat(job.samplesCount()).isEqualTo(6L);
        assertThat(job.cacheKey()).startsWith("timeseries/site-1/2024-01-01_2024-04-10/");
        assertThat(job.message()).isEqualTo("Your data is ready!");
        assertThat(cache.get(job.cacheKey())).isPresent();
        assertThat(jobQueue.depth()).isZero();
    }

    @Test
    @DisplayName("Should retry a transient failure and record the delivery count")
    void testTransientRetry() {
        upstream.thenFail(UpstreamException.forStatus(503, "Service Unavailable"));
        queue("job_a");

        assertThat(processNext()).isEqualTo(JobOutcome.RETRYING);
        JobSnapshot retrying = status("job_a");
        assertThat(retrying.status()).isEqualTo(JobStatus.RETRYING);
        assertThat(retrying.retryCount()).isEqualTo(1);
        assertThat(retrying.message()).isEqualTo("Retrying... (attempt 2)");

        assertThat(processNext()).isEqualTo(JobOutcome.COMPLETED);
        JobSnapshot completed = status("job_a");
        assertThat(completed.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(completed.retryCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should dead-letter after the retry budget and create a recovery record")
    void testRetryExhaustion() {
        upstream.alwaysFail(UpstreamException.forStatus(503, "Service Unavailable"));
        queue("job_a");

        assertThat(processNext()).isEqualTo(JobOutcome.RETRYING);
        assertThat(processNext()).isEqualTo(JobOutcome.RETRYING);
        assertThat(processNext()).isEqualTo(JobOutcome.FAILED);

        JobSnapshot failed = status("job_a");
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.retryCount()).isEqualTo(2);
        assertThat(failed.errorCategory()).isEqualTo(ErrorCategory.TRANSIENT);
        assertThat(jobQueue.depth()).isZero();

        List<Delivery<DeadLetterMessage>> dead = deadLetterQueue.receive(10);
        assertThat(dead).singleElement().satisfies(delivery -> {
            assertThat(delivery.body().jobId()).isEqualTo("job_a");
            assertThat(delivery.body().retryCount()).isEqualTo(2);
            assertThat(delivery.body().category()).isEqualTo(ErrorCategory.TRANSIENT);
        });

        deadLetterHandler.processBatch(dead.stream().map(Delivery::body).toList());
        assertThat(recoveries.findByJobId("job_a")).get()
            .satisfies(record -> assertThat(record.getStatus()).isEqualTo(RecoveryStatus.PENDING));
    }

    @Test
    @DisplayName("Should fail client faults on the first attempt")
    void testClientFaultNotRetried() {
        upstream.alwaysFail(UpstreamException.forStatus(404, "Not Found"));
        queue("job_a");

        assertThat(processNext()).isEqualTo(JobOutcome.FAILED);

        JobSnapshot failed = status("job_a");
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.retryCount()).isZero();
        assertThat(failed.errorCategory()).isEqualTo(ErrorCategory.CLIENT_FAULT);
        assertThat(failed.message()).startsWith("Request failed: ");
        assertThat(upstream.callCount()).isEqualTo(1);
        assertThat(deadLetterQueue.depth()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip a job cancelled before a worker picked it up")
    void testCancelledBeforeProcessing() {
        queue("job_a");

        assertThat(jobQueueManager.cancelJob("job_a")).isTrue();
        assertThat(processNext()).isEqualTo(JobOutcome.SKIPPED);

        assertThat(status("job_a").status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(upstream.callCount()).isZero();
        assertThat(jobQueue.depth()).isZero();
    }

    @Test
    @DisplayName("Should refuse to cancel terminal or unknown jobs")
    void testCancelTerminal() {
        queue("job_a");
        processNext();

        assertThat(jobQueueManager.cancelJob("job_a")).isFalse();
        assertThat(jobQueueManager.cancelJob("job_missing")).isFalse();
        assertThat(status("job_a").status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should acknowledge duplicate deliveries of finished jobs")
    void testDuplicateDelivery() {
        queue("job_a");
        Delivery<JobMessage> delivery = jobQueue.receive(1).get(0);
        jobQueueManager.processJob(delivery);

        assertThat(jobQueueManager.processJob(delivery)).isEqualTo(JobOutcome.SKIPPED);
        assertThat(upstream.callCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count jobs per status")
    void testCountByStatus() {
        queue("job_a");
        jobQueueManager.queueLargeRequest("job_b", "site-2", POINTS, START, END, "user-1", null);
        jobQueueManager.cancelJob("job_b");

        assertThat(jobQueueManager.countByStatus())
            .containsEntry(JobStatus.QUEUED, 1L)
            .containsEntry(JobStatus.CANCELLED, 1L)
            .containsEntry(JobStatus.FAILED, 0L);
    }

    @Test
    @DisplayName("Should drop a failure of a job cancelled while its last attempt was fetching")
    void testCancelledDuringFailingAttempt() {
        upstream.thenFail(UpstreamException.forStatus(503, "Service Unavailable"))
            .thenFail(UpstreamException.forStatus(503, "Service Unavailable"))
            .thenRespond(query -> {
                jobQueueManager.cancelJob("job_a");
                throw UpstreamException.forStatus(503, "Service Unavailable");
            });
        queue("job_a");

        assertThat(processNext()).isEqualTo(JobOutcome.RETRYING);
        assertThat(processNext()).isEqualTo(JobOutcome.RETRYING);
        assertThat(processNext()).isEqualTo(JobOutcome.SKIPPED);

        assertThat(status("job_a").status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(jobQueue.depth()).isZero();
        assertThat(deadLetterQueue.depth()).isZero();
        assertThat(recoveries.findByJobId("job_a")).isEmpty();
    }

    @Test
    @DisplayName("Should hand back the active job when another caller queues an identical request")
    void testIdenticalRequestSharesActiveJob() {
        queue("job_a");

        String second = jobQueueManager.queueLargeRequest("job_b", "site-1", List.of("p3", "p1", "p2"), START, END,
            "user-2", new FetchOptions("json", true, null, null));

        assertThat(second).isEqualTo("job_a");
        assertThat(jobs.findById("job_b")).isEmpty();
        assertThat(jobs.count()).isEqualTo(1);
        assertThat(jobQueue.depth()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept a new job for a request whose previous job finished")
    void testIdenticalRequestAfterTerminalJob() {
        queue("job_a");
        jobQueueManager.cancelJob("job_a");

        assertThat(queue("job_b")).isEqualTo("job_b");
        assertThat(status("job_b").status()).isEqualTo(JobStatus.QUEUED);
        assertThat(jobs.count()).isEqualTo(2);
    }
}
