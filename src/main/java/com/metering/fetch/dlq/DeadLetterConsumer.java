package com.metering.fetch.dlq;

import com.metering.fetch.config.FetchProperties;
import com.metering.fetch.queue.Delivery;
import com.metering.fetch.queue.DurableQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Drains the dead-letter queue in batches. Every received message is acknowledged
 * after handling, whatever the outcome, so DLQ entries never loop.
 */
@Component
@ConditionalOnProperty(prefix = "fetch.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DeadLetterConsumer {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterConsumer.class);

    private final DurableQueue<DeadLetterMessage> deadLetterQueue;
    private final DeadLetterHandler handler;
    private final int batchSize;

    public DeadLetterConsumer(
            DurableQueue<DeadLetterMessage> deadLetterQueue,
            DeadLetterHandler handler,
            FetchProperties properties) {
        this.deadLetterQueue = deadLetterQueue;
        this.handler = handler;
        this.batchSize = properties.getQueue().getBatchSize();
    }

    @Scheduled(fixedDelayString = "#{@fetchProperties.queue.pollInterval.toMillis()}")
    public void poll() {
        List<Delivery<DeadLetterMessage>> deliveries;
        try {
            deliveries = deadLetterQueue.receive(batchSize);
        } catch (RuntimeException e) {
            log.error("Failed to receive from {}: {}", deadLetterQueue.name(), e.getMessage(), e);
            return;
        }
        if (deliveries.isEmpty()) {
            return;
        }

        DlqBatchResult result = handler.processBatch(deliveries.stream()
            .map(Delivery::body)
            .collect(Collectors.toList()));
        deliveries.forEach(deadLetterQueue::ack);

        log.info("DLQ batch of {}: stored={}, alerted={}, recovered={}, errors={}", deliveries.size(),
            result.stored(), result.alerted(), result.recovered(), result.errors());
    }
}
