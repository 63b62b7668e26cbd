package com.flagship.split_ledger.concurrency;

import com.flagship.split_ledger.common.exception.LedgerValidationException;
import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.common.exception.StoreUnavailableException;
import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.UnaryOperator;

/**
 * Applies single-record mutations under an optimistic version check.
 *
 * Each attempt:
 * 1. Opens a transaction scoped to the one record (bounded timeout)
 * 2. Re-reads the record and compares its version to the expected one
 * 3. Applies the mutation function and bumps the version by one
 * 4. Writes back with a compare-and-swap on the old version
 *
 * Of two racing writers holding the same expected version, at most one
 * commits; the other sees CONFLICT and nothing it did is kept. No locks are
 * held across records, so writers to different records never contend.
 *
 * Retrying is the caller's decision, see {@link ConflictRetrier}.
 */
@Component
@Slf4j
public class ConcurrencyController {

    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public ConcurrencyController(@Qualifier("mutationTransactionTemplate") TransactionTemplate transactionTemplate,
                                 Clock clock,
                                 LedgerMetrics metrics) {
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Runs one mutation attempt.
     *
     * @param store           store holding the record
     * @param recordId        record to mutate
     * @param expectedVersion version the caller based its change on
     * @param mutationFn      pure function from current to desired state; may
     *                        throw {@link LedgerValidationException} or any
     *                        other runtime exception, reported as FAILED
     * @return COMMITTED with the stored record, CONFLICT, or FAILED with the cause
     */
    public <T extends VersionedRecord<T>> MutationResult<T> mutate(TransactionalStore<T> store,
                                                                   UUID recordId,
                                                                   long expectedVersion,
                                                                   UnaryOperator<T> mutationFn) {
        MutationState state = MutationState.STARTED;
        log.debug("Mutation {}: recordType={}, recordId={}, expectedVersion={}",
                state, store.recordType(), recordId, expectedVersion);

        MutationResult<T> result;
        try {
            result = transactionTemplate.execute(status ->
                    apply(store, recordId, expectedVersion, mutationFn, status));
        } catch (ConcurrencyFailureException e) {
            log.debug("Store reported a concurrent write on {} {}: {}", store.recordType(), recordId, e.getMessage());
            result = MutationResult.conflict(recordId);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Store failure while mutating {} {}: {}", store.recordType(), recordId, e.getMessage());
            result = MutationResult.failed(recordId,
                    new StoreUnavailableException("Ledger store unavailable while updating " + recordId, e));
        } catch (RuntimeException e) {
            // validation, not-found, forbidden, abandoned attempts and anything the mutation function throws
            log.debug("Mutation of {} {} failed: {}", store.recordType(), recordId, e.toString());
            result = MutationResult.failed(recordId, e);
        }

        if (result == null) {
            result = MutationResult.failed(recordId, new IllegalStateException("Transaction returned no result"));
        }
        metrics.recordMutation(store.recordType(), result.getState().name());
        log.debug("Mutation {}: recordType={}, recordId={}", result.getState(), store.recordType(), recordId);
        return result;
    }

    private <T extends VersionedRecord<T>> MutationResult<T> apply(TransactionalStore<T> store,
                                                                   UUID recordId,
                                                                   long expectedVersion,
                                                                   UnaryOperator<T> mutationFn,
                                                                   TransactionStatus status) {
        log.debug("Mutation {}: recordId={}", MutationState.APPLYING, recordId);

        Optional<T> current = store.read(recordId);
        if (current.isEmpty()) {
            throw new RecordNotFoundException(store.recordType(), recordId);
        }
        if (current.get().getVersion() != expectedVersion) {
            status.setRollbackOnly();
            return MutationResult.conflict(recordId);
        }

        T mutated = mutationFn.apply(current.get());
        T next = mutated.withVersion(expectedVersion + 1, clock.instant());

        // The caller may give up until the very last moment before the write.
        if (Thread.currentThread().isInterrupted()) {
            status.setRollbackOnly();
            throw new CancellationException("Mutation of " + recordId + " abandoned before commit");
        }

        if (!store.writeIfVersion(recordId, expectedVersion, next)) {
            status.setRollbackOnly();
            return MutationResult.conflict(recordId);
        }
        return MutationResult.committed(recordId, next);
    }
}
