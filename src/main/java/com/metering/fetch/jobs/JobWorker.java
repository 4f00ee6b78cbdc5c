package com.metering.fetch.jobs;

import com.metering.fetch.config.FetchProperties;
import com.metering.fetch.queue.Delivery;
import com.metering.fetch.queue.DurableQueue;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the job queue and runs deliveries on a bounded worker pool.
 * A failure in one job is logged and never stops the poll loop.
 */
@Component
@ConditionalOnProperty(prefix = "fetch.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobWorker {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final DurableQueue<JobMessage> queue;
    private final JobQueueManager jobQueueManager;
    private final int batchSize;
    private final Semaphore permits;
    private final ExecutorService workers;

    public JobWorker(DurableQueue<JobMessage> queue, JobQueueManager jobQueueManager, FetchProperties properties) {
        this.queue = queue;
        this.jobQueueManager = jobQueueManager;
        this.batchSize = properties.getQueue().getBatchSize();
        int concurrency = properties.getWorker().getConcurrency();
        this.permits = new Semaphore(concurrency);

        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "job-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Job worker started: concurrency={}, batchSize={}", concurrency, batchSize);
    }

    @Scheduled(fixedDelayString = "#{@fetchProperties.queue.pollInterval.toMillis()}")
    public void poll() {
        int capacity = Math.min(batchSize, permits.availablePermits());
        if (capacity == 0) {
            return;
        }

        List<Delivery<JobMessage>> deliveries;
        try {
            deliveries = queue.receive(capacity);
        } catch (RuntimeException e) {
            log.error("Failed to receive from {}: {}", queue.name(), e.getMessage(), e);
            return;
        }

        for (Delivery<JobMessage> delivery : deliveries) {
            permits.acquireUninterruptibly();
            workers.execute(() -> {
                try {
                    jobQueueManager.processJob(delivery);
                } catch (RuntimeException e) {
                    log.error("Unhandled error processing job {} (delivery {}); lease will expire",
                        delivery.body().jobId(), delivery.messageId(), e);
                } finally {
                    permits.release();
                }
            });
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Job workers did not stop within 30s; interrupting");
            workers.shutdownNow();
        }
    }
}
