package com.metering.fetch.dlq;

/**
 * Per-batch counters.
 *
 * @param stored    messages whose job was marked failed and diagnostics written
 * @param alerted   operator alerts raised
 * @param recovered recovery records created
 * @param errors    individual steps that failed; never cause a batch retry
 */
public record DlqBatchResult(int stored, int alerted, int recovered, int errors) {
}
