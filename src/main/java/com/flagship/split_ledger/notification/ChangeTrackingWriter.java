package com.flagship.split_ledger.notification;

/**
 * Persists one coalesced batch as a single change-tracking update.
 */
public interface ChangeTrackingWriter {

    /**
     * Applies the batch atomically: change version bumped once, category
     * counters increased, recent-changes ring appended.
     *
     * @return the record as stored after the update
     */
    ChangeTrackingRecord write(ChangeBatch batch);
}
