package com.metering.fetch.storage.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface CacheMetadataJpaRepository extends JpaRepository<CacheMetadataEntity, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE CacheMetadataEntity c SET c.hitCount = c.hitCount + 1, c.lastAccessed = :now " +
           "WHERE c.cacheKey = :cacheKey")
    int recordHit(@Param("cacheKey") String cacheKey, @Param("now") Instant now);

    @Query("SELECT COALESCE(SUM(c.hitCount), 0) FROM CacheMetadataEntity c")
    long totalHits();

    @Modifying
    @Transactional
    @Query("DELETE FROM CacheMetadataEntity c WHERE c.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
