package com.flagship.split_ledger.member;

import com.flagship.split_ledger.balance.BalanceQueryService;
import com.flagship.split_ledger.balance.GroupBalances;
import com.flagship.split_ledger.common.exception.LedgerValidationException;
import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.group.GroupStore;
import com.flagship.split_ledger.notification.ChangeCategory;
import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Group membership: join, leave/remove, and the active-member checks the
 * ledger write paths rely on.
 *
 * Rules:
 * - Only existing groups can be joined; the creator's membership is added with the group
 * - A departed member re-joins by reactivating the same membership
 * - A member cannot be removed while holding a non-zero balance in any currency;
 *   ledger writes lock the affected memberships so the check cannot race them
 * - Every join/removal bumps GROUP_DETAILS for all active members (and the removed one)
 */
@Service
@Slf4j
public class GroupMemberService {

    private final GroupMemberRepository repository;
    private final GroupStore groupStore;
    private final BalanceQueryService balanceQueryService;
    private final ChangeNotificationTracker tracker;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public GroupMemberService(GroupMemberRepository repository,
                              GroupStore groupStore,
                              BalanceQueryService balanceQueryService,
                              ChangeNotificationTracker tracker,
                              @Qualifier("mutationTransactionTemplate") TransactionTemplate transactionTemplate,
                              Clock clock) {
        this.repository = repository;
        this.groupStore = groupStore;
        this.balanceQueryService = balanceQueryService;
        this.tracker = tracker;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Adds the user to the group, or reactivates a departed membership.
     *
     * @throws RecordNotFoundException if the group does not exist
     * @throws LedgerValidationException if the user is already an active member
     */
    public GroupMember joinGroup(String groupId, String userId, String displayName,
                                 String groupDisplayName, String themeColor) {
        MDC.put("groupId", groupId);
        try {
            Instant now = clock.instant();
            GroupMember request = GroupMember.builder()
                    .groupId(groupId)
                    .userId(userId)
                    .displayName(displayName)
                    .groupDisplayName(groupDisplayName)
                    .themeColor(themeColor)
                    .joinedAt(now)
                    .build();

            GroupMember joined = transactionTemplate.execute(status -> {
                if (groupStore.find(groupId).isEmpty()) {
                    throw new RecordNotFoundException(GroupStore.RECORD_TYPE, groupId);
                }
                GroupMemberEntity entity = repository.findByGroupIdAndUserId(groupId, userId).orElse(null);
                if (entity == null) {
                    entity = GroupMemberEntity.fromDomain(request);
                } else if (entity.isActive()) {
                    throw new LedgerValidationException("ALREADY_MEMBER",
                            "User " + userId + " is already a member of group " + groupId);
                } else {
                    entity.rejoin(request, now);
                }
                return repository.save(entity).toDomain();
            });

            log.info("Member joined: userId={}", userId);
            tracker.notify(listActiveMemberIds(groupId), groupId, ChangeCategory.GROUP_DETAILS);
            return joined;
        } finally {
            MDC.remove("groupId");
        }
    }

    /**
     * First membership of a group being created. Runs inside the transaction
     * that inserts the group row.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public GroupMember addFounder(String groupId, String userId, String displayName, Instant joinedAt) {
        GroupMember founder = GroupMember.builder()
                .groupId(groupId)
                .userId(userId)
                .displayName(displayName)
                .joinedAt(joinedAt)
                .build();
        return repository.save(GroupMemberEntity.fromDomain(founder)).toDomain();
    }

    /**
     * Marks a member as departed. Used for both leaving (acting user == member)
     * and removal by another member.
     *
     * @throws LedgerValidationException if the member still has an outstanding balance
     */
    public GroupMember removeMember(String groupId, String memberId, String actingUserId) {
        MDC.put("groupId", groupId);
        try {
            requireActiveMember(groupId, actingUserId);

            // The row lock makes in-flight ledger writes naming this member finish
            // first, so the balance read below includes them.
            Instant now = clock.instant();
            GroupMember removed = transactionTemplate.execute(status -> {
                GroupMemberEntity entity = repository.lockMembership(groupId, memberId)
                        .filter(GroupMemberEntity::isActive)
                        .orElseThrow(() -> new RecordNotFoundException("member", groupId + "/" + memberId));
                GroupBalances balances = balanceQueryService.getGroupBalances(groupId);
                if (balances.hasOutstandingBalance(memberId)) {
                    throw new LedgerValidationException("OUTSTANDING_BALANCE",
                            "Cannot remove member " + memberId + " with an outstanding balance");
                }
                entity.leave(now);
                return repository.save(entity).toDomain();
            });

            log.info("Member removed: memberId={}, by={}", memberId, actingUserId);
            Set<String> audience = new LinkedHashSet<>(listActiveMemberIds(groupId));
            audience.add(memberId);
            tracker.notify(audience, groupId, ChangeCategory.GROUP_DETAILS);
            return removed;
        } finally {
            MDC.remove("groupId");
        }
    }

    @Transactional(readOnly = true)
    public List<GroupMember> listMembers(String groupId, boolean includeDeparted) {
        List<GroupMemberEntity> entities = includeDeparted
                ? repository.findByGroupIdOrderByUserIdAsc(groupId)
                : repository.findByGroupIdAndLeftAtIsNullOrderByUserIdAsc(groupId);
        return entities.stream().map(GroupMemberEntity::toDomain).toList();
    }

    /**
     * Active member ids of the group in ascending order.
     */
    @Transactional(readOnly = true)
    public List<String> listActiveMemberIds(String groupId) {
        return repository.findByGroupIdAndLeftAtIsNullOrderByUserIdAsc(groupId)
                .stream()
                .map(GroupMemberEntity::getUserId)
                .toList();
    }

    /**
     * @throws LedgerValidationException if the user is not an active member of the group
     */
    @Transactional(readOnly = true)
    public void requireActiveMember(String groupId, String userId) {
        getActiveMember(groupId, userId);
    }

    /**
     * @throws LedgerValidationException if the user is not an active member of the group
     */
    @Transactional(readOnly = true)
    public GroupMember getActiveMember(String groupId, String userId) {
        return repository.findByGroupIdAndUserId(groupId, userId)
                .filter(GroupMemberEntity::isActive)
                .map(GroupMemberEntity::toDomain)
                .orElseThrow(() -> new LedgerValidationException("NOT_A_MEMBER",
                        "User " + userId + " is not an active member of group " + groupId));
    }

    /**
     * Locks the memberships of everyone whose balance a ledger write changes.
     * Must run inside that write's transaction; removal of any of these
     * members waits until it commits or rolls back.
     *
     * @throws LedgerValidationException if any of them is no longer an active member
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockActiveParticipants(String groupId, Collection<String> userIds) {
        Set<String> requested = new TreeSet<>(userIds);
        Set<String> locked = repository.lockActiveMemberships(groupId, requested).stream()
                .map(GroupMemberEntity::getUserId)
                .collect(Collectors.toSet());
        if (locked.size() != requested.size()) {
            requested.removeAll(locked);
            throw new LedgerValidationException("PARTICIPANT_DEPARTED",
                    "No longer active members of group " + groupId + ": " + requested);
        }
    }
}
