package com.metering.fetch.storage.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobHistoryJpaRepository extends JpaRepository<JobHistoryEntity, Long> {

    List<JobHistoryEntity> findBySiteOrderByCompletedAtDesc(String site);

    boolean existsByJobId(String jobId);
}
