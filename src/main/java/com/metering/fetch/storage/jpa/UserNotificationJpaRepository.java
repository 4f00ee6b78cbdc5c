package com.metering.fetch.storage.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserNotificationJpaRepository extends JpaRepository<UserNotificationEntity, String> {

    List<UserNotificationEntity> findByUserIdOrderByCreatedAtDesc(String userId);

    List<UserNotificationEntity> findByJobId(String jobId);
}
