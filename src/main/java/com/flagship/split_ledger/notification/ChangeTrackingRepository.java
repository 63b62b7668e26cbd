package com.flagship.split_ledger.notification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChangeTrackingRepository extends JpaRepository<ChangeTrackingEntity, UUID> {

    Optional<ChangeTrackingEntity> findByUserIdAndGroupId(String userId, String groupId);

    List<ChangeTrackingEntity> findByUserIdOrderByGroupIdAsc(String userId);
}
