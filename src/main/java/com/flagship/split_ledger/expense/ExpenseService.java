package com.flagship.split_ledger.expense;

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
 * Expense write and read operations.
 *
 * Every write follows the same shape:
 * 1. Check the acting user is an active member of the group
 * 2. Validate the draft and compute splits (nothing written yet)
 * 3. Insert, or update/soft-delete through the conflict retrier, holding row
 *    locks on the memberships of everyone whose balance moves
 * 4. After commit, notify TRANSACTION and BALANCE to the group's active members
 */
@Service
@Slf4j
public class ExpenseService {

    private final ExpenseStore store;
    private final ExpenseValidator validator;
    private final SplitCalculator splitCalculator;
    private final ConflictRetrier retrier;
    private final GroupMemberService memberService;
    private final IdempotencyService idempotencyService;
    private final ChangeNotificationTracker tracker;
    private final TransactionTemplate transactionTemplate;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public ExpenseService(ExpenseStore store,
                          ExpenseValidator validator,
                          SplitCalculator splitCalculator,
                          ConflictRetrier retrier,
                          GroupMemberService memberService,
                          IdempotencyService idempotencyService,
                          ChangeNotificationTracker tracker,
                          @Qualifier("mutationTransactionTemplate") TransactionTemplate transactionTemplate,
                          LedgerMetrics metrics,
                          Clock clock) {
        this.store = store;
        this.validator = validator;
        this.splitCalculator = splitCalculator;
        this.retrier = retrier;
        this.memberService = memberService;
        this.idempotencyService = idempotencyService;
        this.tracker = tracker;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Creates an expense. With an idempotency key, a repeated call returns the
     * expense created by the first one instead of creating another.
     */
    public IdempotentResult<Expense> createExpense(String actingUserId, ExpenseDraft request, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        String groupId = request.getGroupId();
        MDC.put("groupId", groupId);
        try {
            if (idempotencyKey != null) {
                Optional<Expense> existing = findByIdempotencyKey(groupId, idempotencyKey);
                if (existing.isPresent()) {
                    MDC.put("expenseId", existing.get().getId().toString());
                    log.info("Idempotency key already used, returning existing expense");
                    return IdempotentResult.replayed(existing.get());
                }
            }

            Set<String> activeMembers = activeMembers(groupId, actingUserId);
            Instant now = clock.instant();
            ExpenseDraft draft = normalize(request);
            List<ExpenseSplit> splits = validatedSplits(draft, activeMembers, now);

            Expense expense = Expense.builder()
                    .id(UUID.randomUUID())
                    .groupId(groupId)
                    .description(draft.getDescription())
                    .category(draft.getCategory())
                    .date(draft.getDate())
                    .payerId(draft.getPayerId())
                    .amount(draft.getAmount())
                    .currency(draft.getCurrency())
                    .splitType(draft.getSplitType())
                    .splits(splits)
                    .createdBy(actingUserId)
                    .version(1)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            MDC.put("expenseId", expense.getId().toString());

            try {
                transactionTemplate.executeWithoutResult(status -> {
                    memberService.lockActiveParticipants(groupId, expense.affectedMemberIds());
                    store.insert(expense, idempotencyKey);
                });
            } catch (DuplicateKeyException e) {
                // lost a race with a concurrent request carrying the same key
                Expense winner = findByIdempotencyKey(groupId, idempotencyKey).orElseThrow(() -> e);
                return IdempotentResult.replayed(winner);
            } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
                throw new StoreUnavailableException("Could not store expense", e);
            }

            if (idempotencyKey != null) {
                idempotencyService.remember(ExpenseStore.RECORD_TYPE, idempotencyKey, expense.getId());
            }
            notifyGroup(groupId);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordRecordCreated(ExpenseStore.RECORD_TYPE, expense.getCurrency());
            metrics.recordMutationLatency("expense_create", Duration.ofMillis(duration));
            log.info("Expense created: amount={}, currency={}, splitType={}, participants={}, duration={}ms",
                    expense.getAmount(), expense.getCurrency(), expense.getSplitType(),
                    splits.size(), duration);
            return IdempotentResult.created(expense);
        } finally {
            MDC.remove("expenseId");
            MDC.remove("groupId");
        }
    }

    /**
     * Applies a partial update.
     *
     * @param expectedVersion version the client last saw, or null to retry on conflicts
     */
    public Expense updateExpense(UUID expenseId, String actingUserId, ExpensePatch patch, Long expectedVersion) {
        if (patch.isEmpty()) {
            throw new LedgerValidationException("NO_UPDATE_FIELDS", "No valid fields to update");
        }
        long startTime = System.currentTimeMillis();
        MDC.put("expenseId", expenseId.toString());
        try {
            Expense current = getExpense(expenseId);
            String groupId = current.getGroupId();
            MDC.put("groupId", groupId);
            Set<String> activeMembers = activeMembers(groupId, actingUserId);

            Expense updated = retrier.execute(store, expenseId, expectedVersion, existing -> {
                requireLive(existing);
                Instant now = clock.instant();
                ExpenseDraft draft = normalize(patch.applyTo(ExpenseDraft.from(existing)));
                List<ExpenseSplit> splits = validatedSplits(draft, activeMembers, now);
                Expense next = existing.toBuilder()
                        .description(draft.getDescription())
                        .category(draft.getCategory())
                        .date(draft.getDate())
                        .payerId(draft.getPayerId())
                        .amount(draft.getAmount())
                        .currency(draft.getCurrency())
                        .splitType(draft.getSplitType())
                        .splits(splits)
                        .build();
                // members dropped from the split lose their share too
                Set<String> affected = new HashSet<>(existing.affectedMemberIds());
                affected.addAll(next.affectedMemberIds());
                memberService.lockActiveParticipants(groupId, affected);
                return next;
            });

            notifyGroup(groupId);
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordMutationLatency("expense_update", Duration.ofMillis(duration));
            log.info("Expense updated: version={}, duration={}ms", updated.getVersion(), duration);
            return updated;
        } finally {
            MDC.remove("groupId");
            MDC.remove("expenseId");
        }
    }

    /**
     * Soft-deletes the expense: it stays stored with deletion metadata and a
     * bumped version, and no longer counts towards balances.
     */
    public Expense deleteExpense(UUID expenseId, String actingUserId, Long expectedVersion) {
        MDC.put("expenseId", expenseId.toString());
        try {
            Expense current = getExpense(expenseId);
            String groupId = current.getGroupId();
            MDC.put("groupId", groupId);
            memberService.requireActiveMember(groupId, actingUserId);

            Expense deleted = retrier.execute(store, expenseId, expectedVersion, existing -> {
                requireLive(existing);
                memberService.lockActiveParticipants(groupId, existing.affectedMemberIds());
                return existing.markDeleted(actingUserId, clock.instant());
            });

            notifyGroup(groupId);
            log.info("Expense deleted: version={}", deleted.getVersion());
            return deleted;
        } finally {
            MDC.remove("groupId");
            MDC.remove("expenseId");
        }
    }

    /**
     * @throws RecordNotFoundException if the expense does not exist or was deleted
     */
    public Expense getExpense(UUID expenseId) {
        Expense expense = store.read(expenseId)
                .orElseThrow(() -> new RecordNotFoundException(ExpenseStore.RECORD_TYPE, expenseId));
        requireLive(expense);
        return expense;
    }

    public List<Expense> listGroupExpenses(String groupId) {
        return store.listByGroup(groupId);
    }

    private Optional<Expense> findByIdempotencyKey(String groupId, String idempotencyKey) {
        Optional<UUID> existingId = idempotencyService.findExisting(
                ExpenseStore.RECORD_TYPE, idempotencyKey, store::findIdByIdempotencyKey);
        if (existingId.isEmpty()) {
            return Optional.empty();
        }
        Expense existing = store.read(existingId.get())
                .orElseThrow(() -> new IllegalStateException(
                        "Expense found by idempotency key but not by ID: " + existingId.get()));
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

    private List<ExpenseSplit> validatedSplits(ExpenseDraft draft, Set<String> activeMembers, Instant now) {
        validator.validate(draft, activeMembers, now);
        List<ExpenseSplit> splits = splitCalculator.computeSplits(draft);
        validator.validateSplitTotal(draft.getAmount(), splits);
        return splits;
    }

    private static ExpenseDraft normalize(ExpenseDraft draft) {
        return draft.toBuilder()
                .description(draft.getDescription() == null ? null : draft.getDescription().trim())
                .category(draft.getCategory() == null ? null : draft.getCategory().trim())
                .currency(draft.getCurrency() == null ? null : draft.getCurrency().trim().toUpperCase(Locale.ROOT))
                .build();
    }

    private static void requireLive(Expense expense) {
        if (expense.isDeleted()) {
            throw new RecordNotFoundException(ExpenseStore.RECORD_TYPE, expense.getId());
        }
    }

    private void notifyGroup(String groupId) {
        List<String> audience = memberService.listActiveMemberIds(groupId);
        tracker.notify(audience, groupId, ChangeCategory.TRANSACTION);
        tracker.notify(audience, groupId, ChangeCategory.BALANCE);
    }
}
