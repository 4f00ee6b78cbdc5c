package com.metering.fetch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states of a queued job.
 *
 * <pre>
 * queued -----------------&gt; processing
 * processing -------------&gt; completed | retrying | failed
 * retrying ---------------&gt; processing
 * queued | processing | retrying --&gt; cancelled
 * </pre>
 *
 * A redelivered message may re-claim a job that is still {@code processing}
 * (its previous worker died before acknowledging); that self-loop is the only
 * edge not drawn above. Terminal states never change again.
 */
public enum JobStatus {
    QUEUED,
    PROCESSING,
    RETRYING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** States a worker may claim a job from. */
    public static final Set<JobStatus> CLAIMABLE = EnumSet.of(QUEUED, RETRYING, PROCESSING);

    /** States that can still be cancelled. */
    public static final Set<JobStatus> ACTIVE = EnumSet.of(QUEUED, PROCESSING, RETRYING);

    /** States that are final. */
    public static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(JobStatus target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case QUEUED:
                return target == PROCESSING || target == CANCELLED;
            case PROCESSING:
                return target == PROCESSING || target == COMPLETED || target == RETRYING
                    || target == FAILED || target == CANCELLED;
            case RETRYING:
                return target == PROCESSING || target == CANCELLED;
            default:
                return false;
        }
    }

    /**
     * Every state that may legally move into {@code target}.
     */
    public static Set<JobStatus> sourcesOf(JobStatus target) {
        Set<JobStatus> sources = EnumSet.noneOf(JobStatus.class);
        for (JobStatus candidate : values()) {
            if (candidate.canTransitionTo(target)) {
                sources.add(candidate);
            }
        }
        return sources;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
