package com.metering.fetch.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link DurableQueue} with visibility leases and a delivery limit.
 * Messages do not survive a restart.
 */
public class InMemoryDurableQueue<T> implements DurableQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDurableQueue.class);

    private final String name;
    private final Clock clock;
    private final Duration visibilityTimeout;
    private final int maxDeliveries;
    private final DeadLetterSink<T> deadLetterSink;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Message<T>> messages = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryDurableQueue(
            String name,
            Clock clock,
            Duration visibilityTimeout,
            int maxDeliveries,
            DeadLetterSink<T> deadLetterSink) {
        if (maxDeliveries <= 0) {
            throw new IllegalArgumentException("maxDeliveries must be positive");
        }
        this.name = name;
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
        Message<T> message = new Message<>(UUID.randomUUID().toString(), body, rankOf(body),
            sequence.incrementAndGet(), now);
        message.visibleAt = now.plus(delay == null ? Duration.ZERO : delay);
        lock.lock();
        try {
            messages.put(message.id, message);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Delivery<T>> receive(int maxMessages) {
        List<Delivery<T>> deliveries = new ArrayList<>();
        List<Delivery<T>> exhausted = new ArrayList<>();
        Instant now = clock.instant();

        lock.lock();
        try {
            List<Message<T>> visible = new ArrayList<>();
            for (Message<T> message : messages.values()) {
                if (!message.visibleAt.isAfter(now)) {
                    visible.add(message);
                }
            }
            visible.sort(Comparator.<Message<T>>comparingInt(m -> -m.priorityRank)
                .thenComparing(m -> m.visibleAt)
                .thenComparingLong(m -> m.sequence));

            for (Message<T> message : visible) {
                if (deliveries.size() >= maxMessages) {
                    break;
                }
                message.receiveCount++;
                message.receiptHandle = UUID.randomUUID().toString();
                Delivery<T> delivery = new Delivery<>(message.id, message.receiptHandle, message.body,
                    message.receiveCount, message.enqueuedAt);
                if (message.receiveCount > maxDeliveries) {
                    messages.remove(message.id);
                    exhausted.add(delivery);
                    continue;
                }
                message.visibleAt = now.plus(visibilityTimeout);
                deliveries.add(delivery);
            }
        } finally {
            lock.unlock();
        }

        for (Delivery<T> delivery : exhausted) {
            log.warn("Message {} on {} exceeded {} deliveries, moving to dead-letter queue",
                delivery.messageId(), name, maxDeliveries);
            deadLetterSink.accept(delivery, new DeadLetterReason(
                "Delivery limit of " + maxDeliveries + " exceeded", null, null));
        }
        return deliveries;
    }

    @Override
    public void ack(Delivery<T> delivery) {
        lock.lock();
        try {
            Message<T> message = messages.get(delivery.messageId());
            if (message != null && delivery.receiptHandle().equals(message.receiptHandle)) {
                messages.remove(delivery.messageId());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void retry(Delivery<T> delivery, Duration delay) {
        lock.lock();
        try {
            Message<T> message = messages.get(delivery.messageId());
            if (message == null || !delivery.receiptHandle().equals(message.receiptHandle)) {
                log.warn("Retry for stale lease on message {} ignored", delivery.messageId());
                return;
            }
            message.receiptHandle = null;
            message.visibleAt = clock.instant().plus(delay == null ? Duration.ZERO : delay);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deadLetter(Delivery<T> delivery, DeadLetterReason reason) {
        lock.lock();
        try {
            messages.remove(delivery.messageId());
        } finally {
            lock.unlock();
        }
        deadLetterSink.accept(delivery, reason);
    }

    @Override
    public long depth() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purge() {
        lock.lock();
        try {
            int size = messages.size();
            messages.clear();
            return size;
        } finally {
            lock.unlock();
        }
    }

    static int rankOf(Object body) {
        return body instanceof Prioritized prioritized ? prioritized.priorityRank() : 0;
    }

    private static final class Message<T> {
        private final String id;
        private final T body;
        private final int priorityRank;
        private final long sequence;
        private final Instant enqueuedAt;
        private Instant visibleAt;
        private int receiveCount;
        private String receiptHandle;

        private Message(String id, T body, int priorityRank, long sequence, Instant enqueuedAt) {
            this.id = id;
            this.body = body;
            this.priorityRank = priorityRank;
            this.sequence = sequence;
            this.enqueuedAt = enqueuedAt;
        }
    }
}
