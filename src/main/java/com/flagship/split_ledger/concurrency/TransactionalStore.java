package com.flagship.split_ledger.concurrency;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage capability the ledger core needs from its persistence layer.
 *
 * Any engine offering a single-record atomic compare-and-swap satisfies it.
 * Implementations must join the caller's transaction when one is active.
 *
 * @param <T> record type
 */
public interface TransactionalStore<T extends VersionedRecord<T>> {

    /**
     * Reads the current state of a record, deleted or not.
     */
    Optional<T> read(UUID recordId);

    /**
     * Replaces the record only if its stored version still equals
     * {@code expectedVersion}.
     *
     * @return true if the write happened, false if another writer got there first
     */
    boolean writeIfVersion(UUID recordId, long expectedVersion, T newRecord);

    /**
     * Inserts a brand new record.
     */
    void insert(T record);

    /**
     * Snapshot of the group's live (non-deleted) records.
     */
    List<T> listByGroup(String groupId);

    /**
     * Name used in logs, metrics and not-found errors.
     */
    String recordType();
}
