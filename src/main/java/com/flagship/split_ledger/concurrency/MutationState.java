package com.flagship.split_ledger.concurrency;

/**
 * States of a single mutation attempt.
 *
 * STARTED -> APPLYING -> COMMITTED | CONFLICT | FAILED
 */
public enum MutationState {
    STARTED,
    APPLYING,
    COMMITTED,
    CONFLICT,
    FAILED
}
