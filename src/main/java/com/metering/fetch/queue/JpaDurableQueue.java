package com.metering.fetch.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metering.fetch.storage.jpa.QueueMessageEntity;
import com.metering.fetch.storage.jpa.QueueMessageJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link DurableQueue} stored in the {@code queue_messages} table, so queued work
 * survives restarts and can be shared by several service instances. Leases are taken
 * with a conditional UPDATE; a consumer that loses the race simply skips the row.
 */
public class JpaDurableQueue<T> implements DurableQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(JpaDurableQueue.class);

    private final String name;
    private final Class<T> bodyType;
    private final QueueMessageJpaRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration visibilityTimeout;
    private final int maxDeliveries;
    private final DeadLetterSink<T> deadLetterSink;

    public JpaDurableQueue(
            String name,
            Class<T> bodyType,
            QueueMessageJpaRepository repository,
            ObjectMapper objectMapper,
            Clock clock,
            Duration visibilityTimeout,
            int maxDeliveries,
            DeadLetterSink<T> deadLetterSink) {
        this.name = name;
        this.bodyType = bodyType;
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.visibilityTimeout = visibilityTimeout;
        this.maxDeliveries = maxDeliveries;
        this.deadLetterSink = deadLetterSink;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(T body, Duration delay) {
        Instant now = clock.instant();
        repository.save(QueueMessageEntity.builder()
            .id(UUID.randomUUID().toString())
            .queueName(name)
            .payload(serialize(body))
            .priorityRank(InMemoryDurableQueue.rankOf(body))
            .visibleAt(now.plus(delay == null ? Duration.ZERO : delay))
            .receiveCount(0)
            .createdAt(now)
            .build());
    }

    @Override
    public List<Delivery<T>> receive(int maxMessages) {
        Instant now = clock.instant();
        List<Delivery<T>> deliveries = new ArrayList<>();

        for (QueueMessageEntity candidate : repository.findVisible(name, now, PageRequest.of(0, maxMessages))) {
            String handle = UUID.randomUUID().toString();
            if (repository.lease(candidate.getId(), now, now.plus(visibilityTimeout), handle) == 0) {
                continue;
            }
            int attempt = candidate.getReceiveCount() + 1;
            Delivery<T> delivery = new Delivery<>(candidate.getId(), handle,
                deserialize(candidate.getPayload()), attempt, candidate.getCreatedAt());

            if (attempt > maxDeliveries) {
                log.warn("Message {} on {} exceeded {} deliveries, moving to dead-letter queue",
                    candidate.getId(), name, maxDeliveries);
                deadLetter(delivery, new DeadLetterReason(
                    "Delivery limit of " + maxDeliveries + " exceeded", null, null));
                continue;
            }
            deliveries.add(delivery);
        }
        return deliveries;
    }

    @Override
    public void ack(Delivery<T> delivery) {
        if (repository.deleteLeased(delivery.messageId(), delivery.receiptHandle()) == 0) {
            log.debug("Ack for message {} ignored; lease no longer held", delivery.messageId());
        }
    }

    @Override
    public void retry(Delivery<T> delivery, Duration delay) {
        Instant visibleAt = clock.instant().plus(delay == null ? Duration.ZERO : delay);
        if (repository.release(delivery.messageId(), delivery.receiptHandle(), visibleAt) == 0) {
            log.warn("Retry for stale lease on message {} ignored", delivery.messageId());
        }
    }

    @Override
    public void deadLetter(Delivery<T> delivery, DeadLetterReason reason) {
        deadLetterSink.accept(delivery, reason);
        repository.deleteLeased(delivery.messageId(), delivery.receiptHandle());
    }

    @Override
    public long depth() {
        return repository.countByQueueName(name);
    }

    @Override
    public int purge() {
        return repository.purge(name);
    }

    private String serialize(T body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize message for queue " + name, e);
        }
    }

    private T deserialize(String payload) {
        try {
            return objectMapper.readValue(payload, bodyType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt message payload on queue " + name, e);
        }
    }
}
