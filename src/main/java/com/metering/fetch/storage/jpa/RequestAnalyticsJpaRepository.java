package com.metering.fetch.storage.jpa;

import com.metering.fetch.analytics.RouteStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface RequestAnalyticsJpaRepository extends JpaRepository<RequestAnalyticsEntity, Long> {

    /**
     * Per-route request totals since {@code since}.
     */
    @Query("SELECT new com.metering.fetch.analytics.RouteStats(r.routeType, COUNT(r), " +
           "SUM(CASE WHEN r.cacheHit = true THEN 1L ELSE 0L END), " +
           "SUM(CASE WHEN r.success = true THEN 1L ELSE 0L END), " +
           "AVG(r.durationMs)) " +
           "FROM RequestAnalyticsEntity r WHERE r.recordedAt >= :since GROUP BY r.routeType")
    List<RouteStats> summarizeByRoute(@Param("since") Instant since);

    @Modifying
    @Transactional
    @Query("DELETE FROM RequestAnalyticsEntity r WHERE r.recordedAt < :cutoff")
    int deleteRecordedBefore(@Param("cutoff") Instant cutoff);
}
