package com.metering.fetch.upstream;

/**
 * Receives monotonic progress updates while pages are consumed.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, processedPoints, totalPoints) -> { };

    void onProgress(int percent, int processedPoints, int totalPoints);
}
