package com.metering.fetch.queue;

import java.time.Duration;
import java.util.List;

/**
 * At-least-once message transport.
 *
 * Received messages stay invisible for the visibility timeout. A message that is
 * neither acknowledged nor retried before the lease expires is delivered again with
 * an incremented attempt count. Once the attempt count would exceed the transport's
 * delivery limit the message is handed to its {@link DeadLetterSink} instead.
 * Implementations raise unchecked exceptions when the backend is unavailable.
 */
public interface DurableQueue<T> {

    String name();

    default void send(T message) {
        send(message, Duration.ZERO);
    }

    void send(T message, Duration delay);

    List<Delivery<T>> receive(int maxMessages);

    void ack(Delivery<T> delivery);

    /**
     * Release the lease and make the message visible again after {@code delay}.
     */
    void retry(Delivery<T> delivery, Duration delay);

    /**
     * Remove the message and pass it to the dead-letter sink.
     */
    void deadLetter(Delivery<T> delivery, DeadLetterReason reason);

    /** Approximate number of messages held, visible or not. */
    long depth();

    int purge();
}
