package com.flagship.split_ledger.concurrency;

import com.flagship.split_ledger.common.exception.StoreUnavailableException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * Terminal outcome of one mutation attempt.
 *
 * {@link MutationState#CONFLICT} is the expected outcome of a lost race and
 * is kept apart from {@link MutationState#FAILED}, so callers can retry the
 * first silently and surface the second.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MutationResult<T> {
    UUID recordId;
    MutationState state;
    T record;
    RuntimeException error;

    public static <T> MutationResult<T> committed(UUID recordId, T record) {
        return new MutationResult<>(recordId, MutationState.COMMITTED, record, null);
    }

    public static <T> MutationResult<T> conflict(UUID recordId) {
        return new MutationResult<>(recordId, MutationState.CONFLICT, null, null);
    }

    public static <T> MutationResult<T> failed(UUID recordId, RuntimeException error) {
        return new MutationResult<>(recordId, MutationState.FAILED, null, error);
    }

    public boolean isCommitted() {
        return state == MutationState.COMMITTED;
    }

    public boolean isConflict() {
        return state == MutationState.CONFLICT;
    }

    public boolean isFailed() {
        return state == MutationState.FAILED;
    }

    /**
     * Transient failures may succeed on a later attempt; validation and
     * not-found failures will not.
     */
    public boolean isRetryable() {
        return isConflict() || (isFailed() && error instanceof StoreUnavailableException);
    }

    /**
     * Returns the committed record or rethrows the failure.
     *
     * @throws IllegalStateException if called on a conflict
     */
    public T getOrThrow() {
        return switch (state) {
            case COMMITTED -> record;
            case FAILED -> throw error;
            default -> throw new IllegalStateException("Mutation of " + recordId + " ended in " + state);
        };
    }
}
