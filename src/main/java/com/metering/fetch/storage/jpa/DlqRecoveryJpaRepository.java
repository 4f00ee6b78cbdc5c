package com.metering.fetch.storage.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface DlqRecoveryJpaRepository extends JpaRepository<DlqRecoveryEntity, Long> {

    Optional<DlqRecoveryEntity> findByJobId(String jobId);

    boolean existsByJobId(String jobId);

    long countByStatus(RecoveryStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DlqRecoveryEntity r SET r.status = :to, r.resolvedAt = :now, " +
           "r.requeuedJobId = :requeuedJobId " +
           "WHERE r.jobId = :jobId AND r.status = com.metering.fetch.storage.jpa.RecoveryStatus.PENDING")
    int resolve(
        @Param("jobId") String jobId,
        @Param("to") RecoveryStatus to,
        @Param("requeuedJobId") String requeuedJobId,
        @Param("now") Instant now
    );
}
