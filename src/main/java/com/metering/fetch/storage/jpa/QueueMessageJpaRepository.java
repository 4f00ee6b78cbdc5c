package com.metering.fetch.storage.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface QueueMessageJpaRepository extends JpaRepository<QueueMessageEntity, String> {

    @Query("SELECT m FROM QueueMessageEntity m WHERE m.queueName = :queueName AND m.visibleAt <= :now " +
           "ORDER BY m.priorityRank DESC, m.visibleAt ASC")
    List<QueueMessageEntity> findVisible(
        @Param("queueName") String queueName,
        @Param("now") Instant now,
        Pageable pageable
    );

    /**
     * Lease a visible message. Returns 0 when another consumer leased it first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueueMessageEntity m SET m.visibleAt = :leaseUntil, m.receiveCount = m.receiveCount + 1, " +
           "m.receiptHandle = :receiptHandle " +
           "WHERE m.id = :id AND m.visibleAt <= :now")
    int lease(
        @Param("id") String id,
        @Param("now") Instant now,
        @Param("leaseUntil") Instant leaseUntil,
        @Param("receiptHandle") String receiptHandle
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE QueueMessageEntity m SET m.visibleAt = :visibleAt, m.receiptHandle = NULL " +
           "WHERE m.id = :id AND m.receiptHandle = :receiptHandle")
    int release(
        @Param("id") String id,
        @Param("receiptHandle") String receiptHandle,
        @Param("visibleAt") Instant visibleAt
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("DELETE FROM QueueMessageEntity m WHERE m.id = :id AND m.receiptHandle = :receiptHandle")
    int deleteLeased(@Param("id") String id, @Param("receiptHandle") String receiptHandle);

    long countByQueueName(String queueName);

    @Modifying
    @Transactional
    @Query("DELETE FROM QueueMessageEntity m WHERE m.queueName = :queueName")
    int purge(@Param("queueName") String queueName);
}
