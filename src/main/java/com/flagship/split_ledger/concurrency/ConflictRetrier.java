package com.flagship.split_ledger.concurrency;

import com.flagship.split_ledger.common.exception.ConflictException;
import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.config.LedgerProperties;
import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.UnaryOperator;

/**
 * Caller-side retry policy around {@link ConcurrencyController}.
 *
 * Two modes:
 * - Explicit version (the client sent If-Match): one attempt, a conflict is
 *   surfaced immediately because the client's view is stale.
 * - No version: re-read the current version and retry on conflict, up to
 *   {@code ledger.mutation.max-attempts} attempts with linear backoff and
 *   within {@code ledger.mutation.max-total-duration}.
 *
 * FAILED outcomes are never retried here; their cause is rethrown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConflictRetrier {

    private final ConcurrencyController controller;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * @param expectedVersion version supplied by the client, or null to use the current one
     * @return the committed record
     * @throws ConflictException when the version check kept failing
     */
    public <T extends VersionedRecord<T>> T execute(TransactionalStore<T> store,
                                                    UUID recordId,
                                                    Long expectedVersion,
                                                    UnaryOperator<T> mutationFn) {
        if (expectedVersion != null) {
            MutationResult<T> result = controller.mutate(store, recordId, expectedVersion, mutationFn);
            if (result.isConflict()) {
                metrics.recordConflictExhausted(store.recordType());
                throw new ConflictException(recordId, 1);
            }
            return result.getOrThrow();
        }

        LedgerProperties.Mutation settings = properties.getMutation();
        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        Instant deadline = clock.instant().plus(settings.getMaxTotalDuration());

        for (int attempt = 1; ; attempt++) {
            long currentVersion = store.read(recordId)
                    .orElseThrow(() -> new RecordNotFoundException(store.recordType(), recordId))
                    .getVersion();

            MutationResult<T> result = controller.mutate(store, recordId, currentVersion, mutationFn);
            if (!result.isConflict()) {
                return result.getOrThrow();
            }

            Duration backoff = settings.getBackoff().multipliedBy(attempt);
            if (attempt >= maxAttempts || clock.instant().plus(backoff).isAfter(deadline)) {
                log.warn("Giving up on {} {} after {} conflicting attempt(s)", store.recordType(), recordId, attempt);
                metrics.recordConflictExhausted(store.recordType());
                throw new ConflictException(recordId, attempt);
            }

            log.debug("Conflict on {} {} (attempt {}/{}), retrying in {}ms",
                    store.recordType(), recordId, attempt, maxAttempts, backoff.toMillis());
            metrics.recordConflictRetry(store.recordType());
            sleep(backoff);
        }
    }

    private static void sleep(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while backing off after a conflict");
        }
    }
}
