package com.metering.fetch.jobs;

import com.metering.fetch.queue.Prioritized;

import java.time.Instant;
import java.util.List;

/**
 * Queue payload for one fetch job. The job row is the source of truth for status;
 * the message only carries what a worker needs to run the fetch.
 */
public record JobMessage(
    String jobId,
    String site,
    List<String> points,
    Instant startTime,
    Instant endTime,
    String userId,
    FetchOptions options
) implements Prioritized {

    public JobMessage {
        points = points == null ? List.of() : List.copyOf(points);
        options = options == null ? FetchOptions.defaults() : options;
    }

    @Override
    public int priorityRank() {
        return options.priority().rank();
    }
}
