package com.metering.fetch.storage.jpa;

import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.domain.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data repository for job records.
 *
 * Every status change is a single-row conditional UPDATE guarded by the set of
 * states allowed to move into the target state. A return value of 0 means another
 * writer got there first (typically a cancellation) and the caller must not proceed.
 * Terminal updates also release {@code activeRequestHash}.
 */
@Repository
public interface QueueJobJpaRepository extends JpaRepository<QueueJobEntity, String> {

    Optional<QueueJobEntity> findFirstByRequestHashOrderByCreatedAtDesc(String requestHash);

    Optional<QueueJobEntity> findByActiveRequestHash(String activeRequestHash);

    List<QueueJobEntity> findByStatusOrderByFailedAtDesc(JobStatus status, Pageable pageable);

    List<QueueJobEntity> findByStatusInAndCreatedAtBefore(Collection<JobStatus> statuses, Instant cutoff);

    long countByStatus(JobStatus status);

    long countByStatusAndFailedAtAfter(JobStatus status, Instant since);

    @Query("SELECT AVG(j.retryCount) FROM QueueJobEntity j WHERE j.status = :status")
    Double averageRetryCount(@Param("status") JobStatus status);

    @Query("SELECT j.status, COUNT(j) FROM QueueJobEntity j GROUP BY j.status")
    List<Object[]> countGroupedByStatus();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueueJobEntity j SET j.status = com.metering.fetch.domain.JobStatus.PROCESSING, " +
           "j.retryCount = :retryCount, j.startedAt = COALESCE(j.startedAt, :now) " +
           "WHERE j.jobId = :jobId AND j.status IN :from")
    int markProcessing(
        @Param("jobId") String jobId,
        @Param("from") Collection<JobStatus> from,
        @Param("retryCount") int retryCount,
        @Param("now") Instant now
    );

    /**
     * Progress only moves forward; stale or out-of-order updates are ignored.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueueJobEntity j SET j.progress = :progress, " +
           "j.processedPoints = :processedPoints, j.totalPoints = :totalPoints " +
           "WHERE j.jobId = :jobId AND j.status = com.metering.fetch.domain.JobStatus.PROCESSING " +
           "AND j.progress <= :progress")
    int updateProgress(
        @Param("jobId") String jobId,
        @Param("progress") int progress,
        @Param("processedPoints") int processedPoints,
        @Param("totalPoints") int totalPoints
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueueJobEntity j SET j.status = com.metering.fetch.domain.JobStatus.COMPLETED, " +
           "j.progress = 100, j.samplesCount = :samplesCount, j.dataSize = :dataSize, " +
           "j.cacheKey = :cacheKey, j.truncated = :truncated, j.completedAt = :now, " +
           "j.processingTimeMs = :processingTimeMs, j.errorMessage = NULL, j.errorCategory = NULL, " +
           "j.activeRequestHash = NULL " +
           "WHERE j.jobId = :jobId AND j.status = com.metering.fetch.domain.JobStatus.PROCESSING")
    int markCompleted(
        @Param("jobId") String jobId,
        @Param("samplesCount") long samplesCount,
        @Param("dataSize") long dataSize,
        @Param("cacheKey") String cacheKey,
        @Param("truncated") boolean truncated,
        @Param("processingTimeMs") long processingTimeMs,
        @Param("now") Instant now
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueueJobEntity j SET j.status = com.metering.fetch.domain.JobStatus.RETRYING, " +
           "j.retryCount = :retryCount, j.errorMessage = :error, j.errorCategory = :category " +
           "WHERE j.jobId = :jobId AND j.status = com.metering.fetch.domain.JobStatus.PROCESSING")
    int markRetrying(
        @Param("jobId") String jobId,
        @Param("retryCount") int retryCount,
        @Param("error") String error,
        @Param("category") ErrorCategory category
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueueJobEntity j SET j.status = com.metering.fetch.domain.JobStatus.FAILED, " +
           "j.errorMessage = :error, j.errorCategory = :category, j.retryCount = :retryCount, " +
           "j.failedAt = COALESCE(j.failedAt, :now), " +
           "j.processingTimeMs = COALESCE(j.processingTimeMs, :processingTimeMs), j.activeRequestHash = NULL " +
           "WHERE j.jobId = :jobId AND j.status IN :from")
    int markFailed(
        @Param("jobId") String jobId,
        @Param("from") Collection<JobStatus> from,
        @Param("error") String error,
        @Param("category") ErrorCategory category,
        @Param("retryCount") int retryCount,
        @Param("processingTimeMs") Long processingTimeMs,
        @Param("now") Instant now
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueueJobEntity j SET j.status = com.metering.fetch.domain.JobStatus.CANCELLED, " +
           "j.cancelledAt = :now, j.activeRequestHash = NULL " +
           "WHERE j.jobId = :jobId AND j.status IN :from")
    int markCancelled(
        @Param("jobId") String jobId,
        @Param("from") Collection<JobStatus> from,
        @Param("now") Instant now
    );
}
