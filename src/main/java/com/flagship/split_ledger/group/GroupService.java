package com.flagship.split_ledger.group;

import com.flagship.split_ledger.common.exception.ForbiddenOperationException;
import com.flagship.split_ledger.common.exception.LedgerValidationException;
import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.common.exception.StoreUnavailableException;
import com.flagship.split_ledger.concurrency.ConflictRetrier;
import com.flagship.split_ledger.member.GroupMemberService;
import com.flagship.split_ledger.notification.ChangeCategory;
import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Group lifecycle: create, read and edit the group's details.
 *
 * Rules:
 * - The creator becomes the first member in the same transaction as the group row
 * - Only active members see a group; everyone else gets not-found
 * - Only the creator may change the name or description
 * - Create and update bump GROUP_DETAILS for the group's active members
 */
@Service
@Slf4j
public class GroupService {

    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_DESCRIPTION_LENGTH = 500;

    private final GroupStore store;
    private final GroupMemberService memberService;
    private final ConflictRetrier retrier;
    private final ChangeNotificationTracker tracker;
    private final TransactionTemplate transactionTemplate;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public GroupService(GroupStore store,
                        GroupMemberService memberService,
                        ConflictRetrier retrier,
                        ChangeNotificationTracker tracker,
                        @Qualifier("mutationTransactionTemplate") TransactionTemplate transactionTemplate,
                        LedgerMetrics metrics,
                        Clock clock) {
        this.store = store;
        this.memberService = memberService;
        this.retrier = retrier;
        this.tracker = tracker;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @param creatorName display name of the creator's membership; defaults to their user id
     */
    public Group createGroup(String creatorId, String name, String description, String creatorName) {
        long startTime = System.currentTimeMillis();
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Group group = validated(Group.builder()
                .id(UUID.randomUUID())
                .name(name == null ? null : name.trim())
                .description(description == null || description.isBlank() ? null : description.trim())
                .createdBy(creatorId)
                .version(1)
                .createdAt(now)
                .updatedAt(now)
                .build());
        String groupId = group.getGroupId();
        MDC.put("groupId", groupId);
        try {
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    store.insert(group);
                    memberService.addFounder(groupId, creatorId,
                            creatorName == null || creatorName.isBlank() ? creatorId : creatorName.trim(), now);
                });
            } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
                throw new StoreUnavailableException("Could not store group", e);
            }

            tracker.notify(List.of(creatorId), groupId, ChangeCategory.GROUP_DETAILS);
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordMutationLatency("group_create", Duration.ofMillis(duration));
            log.info("Group created: name={}, createdBy={}, duration={}ms", group.getName(), creatorId, duration);
            return group;
        } finally {
            MDC.remove("groupId");
        }
    }

    /**
     * @throws RecordNotFoundException if the group does not exist or the user is not an active member
     */
    public Group getGroup(String groupId, String userId) {
        Group group = store.find(groupId)
                .orElseThrow(() -> new RecordNotFoundException(GroupStore.RECORD_TYPE, groupId));
        if (!memberService.listActiveMemberIds(groupId).contains(userId)) {
            throw new RecordNotFoundException(GroupStore.RECORD_TYPE, groupId);
        }
        return group;
    }

    /**
     * @param expectedVersion version the client last saw, or null to retry on conflicts
     * @throws ForbiddenOperationException if the acting user did not create the group
     */
    public Group updateGroup(String groupId, String actingUserId, GroupPatch patch, Long expectedVersion) {
        if (patch.isEmpty()) {
            throw new LedgerValidationException("NO_UPDATE_FIELDS", "No valid fields to update");
        }
        MDC.put("groupId", groupId);
        try {
            Group current = getGroup(groupId, actingUserId);

            Group updated = retrier.execute(store, current.getId(), expectedVersion, existing -> {
                if (!existing.getCreatedBy().equals(actingUserId)) {
                    throw new ForbiddenOperationException("NOT_GROUP_OWNER",
                            "Only the group's creator can change its details");
                }
                return validated(patch.applyTo(existing));
            });

            tracker.notify(memberService.listActiveMemberIds(groupId), groupId, ChangeCategory.GROUP_DETAILS);
            log.info("Group updated: version={}", updated.getVersion());
            return updated;
        } finally {
            MDC.remove("groupId");
        }
    }

    private static Group validated(Group group) {
        if (group.getName() == null || group.getName().isEmpty() || group.getName().length() > MAX_NAME_LENGTH) {
            throw new LedgerValidationException("INVALID_NAME",
                    "Group name must be between 1 and " + MAX_NAME_LENGTH + " characters");
        }
        if (group.getDescription() != null && group.getDescription().length() > MAX_DESCRIPTION_LENGTH) {
            throw new LedgerValidationException("INVALID_DESCRIPTION",
                    "Group description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return group;
    }
}
