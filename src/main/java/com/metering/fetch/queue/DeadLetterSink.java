package com.metering.fetch.queue;

/**
 * Target of dead-lettered deliveries, supplied to a transport at construction.
 */
@FunctionalInterface
public interface DeadLetterSink<T> {

    void accept(Delivery<T> delivery, DeadLetterReason reason);
}
