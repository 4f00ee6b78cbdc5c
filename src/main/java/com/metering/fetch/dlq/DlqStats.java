package com.metering.fetch.dlq;

public record DlqStats(
    long totalFailed,
    long last24h,
    double avgRetries,
    RecoveryStats recovery
) {

    public record RecoveryStats(long total, long pending, long recovered, long abandoned) {
    }
}
