package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.common.exception.ForbiddenOperationException;
import com.flagship.split_ledger.common.exception.LedgerValidationException;
import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.common.exception.StoreUnavailableException;
import com.flagship.split_ledger.common.idempotency.IdempotencyService;
import com.flagship.split_ledger.common.idempotency.IdempotentResult;
import com.flagship.split_ledger.concurrency.ConflictRetrier;
import com.flagship.split_ledger.member.GroupMemberService;
import com.flagship.split_ledger.notification.ChangeCategory;
import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Settlement write and read operations.
 *
 * Same flow as expenses, plus one rule: only the member who recorded a
 * settlement may change or delete it.
 */
@Service
@Slf4j
public class SettlementService {

    private final SettlementStore store;
    private final SettlementValidator validator;
    private final ConflictRetrier retrier;
    private final GroupMemberService memberService;
    private final IdempotencyService idempotencyService;
    private final ChangeNotificationTracker tracker;
    private final TransactionTemplate transactionTemplate;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public SettlementService(SettlementStore store,
                             SettlementValidator validator,
                             ConflictRetrier retrier,
                             GroupMemberService memberService,
                             IdempotencyService idempotencyService,
                             ChangeNotificationTracker tracker,
                             @Qualifier("mutationTransactionTemplate") TransactionTemplate transactionTemplate,
                             LedgerMetrics metrics,
                             Clock clock) {
        this.store = store;
        this.validator = validator;
        this.retrier = retrier;
        this.memberService = memberService;
        this.idempotencyService = idempotencyService;
        this.tracker = tracker;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.clock = clock;
    }

    public IdempotentResult<Settlement> createSettlement(String actingUserId, SettlementDraft request,
                                                         String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        String groupId = request.getGroupId();
        MDC.put("groupId", groupId);
        try {
            if (idempotencyKey != null) {
                Optional<Settlement> existing = findByIdempotencyKey(groupId, idempotencyKey);
                if (existing.isPresent()) {
                    log.info("Idempotency key already used, returning settlement {}", existing.get().getId());
                    return IdempotentResult.replayed(existing.get());
                }
            }

            Set<String> activeMembers = activeMembers(groupId, actingUserId);
            Instant now = clock.instant();
            SettlementDraft draft = normalize(request, now);
            validator.validate(draft, activeMembers, now);

            Settlement settlement = Settlement.builder()
                    .id(UUID.randomUUID())
                    .groupId(groupId)
                    .payerId(draft.getPayerId())
                    .payeeId(draft.getPayeeId())
                    .amount(draft.getAmount())
                    .currency(draft.getCurrency())
                    .date(draft.getDate())
                    .note(draft.getNote())
                    .createdBy(actingUserId)
                    .version(1)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            MDC.put("settlementId", settlement.getId().toString());

            try {
                transactionTemplate.executeWithoutResult(status -> {
                    memberService.lockActiveParticipants(groupId, settlement.affectedMemberIds());
                    store.insert(settlement, idempotencyKey);
                });
            } catch (DuplicateKeyException e) {
                Settlement winner = findByIdempotencyKey(groupId, idempotencyKey).orElseThrow(() -> e);
                return IdempotentResult.replayed(winner);
            } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
                throw new StoreUnavailableException("Could not store settlement", e);
            }

            if (idempotencyKey != null) {
                idempotencyService.remember(SettlementStore.RECORD_TYPE, idempotencyKey, settlement.getId());
            }
            notifyGroup(groupId);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordRecordCreated(SettlementStore.RECORD_TYPE, settlement.getCurrency());
            metrics.recordMutationLatency("settlement_create", Duration.ofMillis(duration));
            log.info("Settlement created: payer={}, payee={}, amount={}, currency={}, duration={}ms",
                    settlement.getPayerId(), settlement.getPayeeId(), settlement.getAmount(),
                    settlement.getCurrency(), duration);
            return IdempotentResult.created(settlement);
        } finally {
            MDC.remove("settlementId");
            MDC.remove("groupId");
        }
    }

    /**
     * @param expectedVersion version the client last saw, or null to retry on conflicts
     * @throws ForbiddenOperationException if the acting user did not record the settlement
     */
    public Settlement updateSettlement(UUID settlementId, String actingUserId, SettlementPatch patch,
                                       Long expectedVersion) {
        if (patch.isEmpty()) {
            throw new LedgerValidationException("NO_UPDATE_FIELDS", "No valid fields to update");
        }
        long startTime = System.currentTimeMillis();
        MDC.put("settlementId", settlementId.toString());
        try {
            Settlement current = getSettlement(settlementId);
            String groupId = current.getGroupId();
            MDC.put("groupId", groupId);
            Set<String> activeMembers = activeMembers(groupId, actingUserId);

            Settlement updated = retrier.execute(store, settlementId, expectedVersion, existing -> {
                requireLive(existing);
                requireCreator(existing, actingUserId, "update");
                Instant now = clock.instant();
                SettlementDraft draft = normalize(patch.applyTo(SettlementDraft.from(existing)), now);
                validator.validate(draft, activeMembers, now);
                memberService.lockActiveParticipants(groupId, existing.affectedMemberIds());
                return existing.toBuilder()
                        .amount(draft.getAmount())
                        .currency(draft.getCurrency())
                        .date(draft.getDate())
                        .note(draft.getNote())
                        .build();
            });

            notifyGroup(groupId);
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordMutationLatency("settlement_update", Duration.ofMillis(duration));
            log.info("Settlement updated: version={}, duration={}ms", updated.getVersion(), duration);
            return updated;
        } finally {
            MDC.remove("groupId");
            MDC.remove("settlementId");
        }
    }

    public Settlement deleteSettlement(UUID settlementId, String actingUserId, Long expectedVersion) {
        MDC.put("settlementId", settlementId.toString());
        try {
            Settlement current = getSettlement(settlementId);
            String groupId = current.getGroupId();
            MDC.put("groupId", groupId);
            memberService.requireActiveMember(groupId, actingUserId);

            Settlement deleted = retrier.execute(store, settlementId, expectedVersion, existing -> {
                requireLive(existing);
                requireCreator(existing, actingUserId, "delete");
                memberService.lockActiveParticipants(groupId, existing.affectedMemberIds());
                return existing.markDeleted(actingUserId, clock.instant());
            });

            notifyGroup(groupId);
            log.info("Settlement deleted: version={}", deleted.getVersion());
            return deleted;
        } finally {
            MDC.remove("groupId");
            MDC.remove("settlementId");
        }
    }

    /**
     * @throws RecordNotFoundException if the settlement does not exist or was deleted
     */
    public Settlement getSettlement(UUID settlementId) {
        Settlement settlement = store.read(settlementId)
                .orElseThrow(() -> new RecordNotFoundException(SettlementStore.RECORD_TYPE, settlementId));
        requireLive(settlement);
        return settlement;
    }

    public List<Settlement> listGroupSettlements(String groupId) {
        return store.listByGroup(groupId);
    }

    private Optional<Settlement> findByIdempotencyKey(String groupId, String idempotencyKey) {
        Optional<UUID> existingId = idempotencyService.findExisting(
                SettlementStore.RECORD_TYPE, idempotencyKey, store::findIdByIdempotencyKey);
        if (existingId.isEmpty()) {
            return Optional.empty();
        }
        Settlement existing = store.read(existingId.get())
                .orElseThrow(() -> new IllegalStateException(
                        "Settlement found by idempotency key but not by ID: " + existingId.get()));
        if (!existing.getGroupId().equals(groupId)) {
            throw new LedgerValidationException("IDEMPOTENCY_KEY_REUSED",
                    "Idempotency key was already used for a different request");
        }
        return Optional.of(existing);
    }

    private Set<String> activeMembers(String groupId, String actingUserId) {
        Set<String> active = new HashSet<>(memberService.listActiveMemberIds(groupId));
        if (!active.contains(actingUserId)) {
            throw new LedgerValidationException("NOT_A_MEMBER",
                    "User " + actingUserId + " is not an active member of group " + groupId);
        }
        return active;
    }

    private static SettlementDraft normalize(SettlementDraft draft, Instant now) {
        String note = draft.getNote() == null || draft.getNote().isBlank() ? null : draft.getNote().trim();
        return draft.toBuilder()
                .currency(draft.getCurrency() == null ? null : draft.getCurrency().trim().toUpperCase(Locale.ROOT))
                .date(draft.getDate() == null ? now : draft.getDate())
                .note(note)
                .build();
    }

    private static void requireLive(Settlement settlement) {
        if (settlement.isDeleted()) {
            throw new RecordNotFoundException(SettlementStore.RECORD_TYPE, settlement.getId());
        }
    }

    private static void requireCreator(Settlement settlement, String actingUserId, String action) {
        if (!settlement.getCreatedBy().equals(actingUserId)) {
            throw new ForbiddenOperationException("NOT_SETTLEMENT_CREATOR",
                    "Only the creator can " + action + " this settlement");
        }
    }

    private void notifyGroup(String groupId) {
        List<String> audience = memberService.listActiveMemberIds(groupId);
        tracker.notify(audience, groupId, ChangeCategory.TRANSACTION);
        tracker.notify(audience, groupId, ChangeCategory.BALANCE);
    }
}
