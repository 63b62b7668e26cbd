package com.flagship.split_ledger.concurrency;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger record carrying an optimistic version stamp.
 *
 * @param <T> the concrete record type, so {@link #withVersion} stays typed
 */
public interface VersionedRecord<T extends VersionedRecord<T>> {

    UUID getId();

    String getGroupId();

    long getVersion();

    /**
     * Returns a copy stamped with the given version and update time.
     */
    T withVersion(long version, Instant updatedAt);
}
