package com.flagship.split_ledger.common.idempotency;

import lombok.Value;

/**
 * Outcome of an idempotent create: the record, and whether it was created
 * by this call or returned for a repeated Idempotency-Key.
 */
@Value
public class IdempotentResult<T> {
    T record;
    boolean replayed;

    public static <T> IdempotentResult<T> created(T record) {
        return new IdempotentResult<>(record, false);
    }

    public static <T> IdempotentResult<T> replayed(T record) {
        return new IdempotentResult<>(record, true);
    }
}
