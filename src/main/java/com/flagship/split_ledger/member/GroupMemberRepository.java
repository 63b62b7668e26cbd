package com.flagship.split_ledger.member;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GroupMemberRepository extends JpaRepository<GroupMemberEntity, UUID> {

    Optional<GroupMemberEntity> findByGroupIdAndUserId(String groupId, String userId);

    List<GroupMemberEntity> findByGroupIdAndLeftAtIsNullOrderByUserIdAsc(String groupId);

    List<GroupMemberEntity> findByGroupIdOrderByUserIdAsc(String groupId);

    /**
     * Row lock on one membership, held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM GroupMemberEntity m WHERE m.groupId = :groupId AND m.userId = :userId")
    Optional<GroupMemberEntity> lockMembership(@Param("groupId") String groupId, @Param("userId") String userId);

    /**
     * Row locks on the still-active memberships among {@code userIds}, taken in
     * user id order so concurrent writers always lock in the same sequence.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM GroupMemberEntity m WHERE m.groupId = :groupId AND m.userId IN :userIds "
            + "AND m.leftAt IS NULL ORDER BY m.userId ASC")
    List<GroupMemberEntity> lockActiveMemberships(@Param("groupId") String groupId,
                                                  @Param("userIds") Collection<String> userIds);
}
