package com.metering.fetch.queue;

/**
 * Implemented by message bodies that carry an ordering hint. Higher ranks are received first.
 */
public interface Prioritized {

    int priorityRank();
}
