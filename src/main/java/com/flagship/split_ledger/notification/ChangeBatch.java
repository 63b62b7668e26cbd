package com.flagship.split_ledger.notification;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable snapshot of the increments coalesced for one key during a quiet
 * window. Handed to the {@link ChangeTrackingWriter} as a single update.
 */
@Value
public class ChangeBatch {
    ChangeKey key;
    Map<ChangeCategory, Long> counts;
    Map<ChangeCategory, Instant> lastRequestedAt;
    int attempt;

    ChangeBatch(ChangeKey key, Map<ChangeCategory, Long> counts,
                Map<ChangeCategory, Instant> lastRequestedAt, int attempt) {
        this.key = key;
        this.counts = Collections.unmodifiableMap(new EnumMap<>(counts));
        this.lastRequestedAt = Collections.unmodifiableMap(new EnumMap<>(lastRequestedAt));
        this.attempt = attempt;
    }

    public long totalIncrements() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    public long count(ChangeCategory category) {
        return counts.getOrDefault(category, 0L);
    }
}
