package com.flagship.split_ledger.notification;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per (user, group) change counters that clients poll or subscribe to.
 *
 * Invariants:
 * - {@code changeVersion} grows by exactly one per persisted batch
 * - category counters never decrease
 * - {@code recentChanges} keeps the newest entries last, bounded by the writer's limit
 */
@Value
@Builder(toBuilder = true)
public class ChangeTrackingRecord {
    String userId;
    String groupId;
    long changeVersion;
    Map<ChangeCategory, CategoryCounter> counters;
    List<RecentChange> recentChanges;
    Instant lastModified;

    public static ChangeTrackingRecord empty(ChangeKey key) {
        return ChangeTrackingRecord.builder()
                .userId(key.getUserId())
                .groupId(key.getGroupId())
                .changeVersion(0)
                .counters(Collections.emptyMap())
                .recentChanges(List.of())
                .build();
    }

    public ChangeKey key() {
        return ChangeKey.of(userId, groupId);
    }

    public CategoryCounter counter(ChangeCategory category) {
        return counters.getOrDefault(category, CategoryCounter.ZERO);
    }

    /**
     * Returns the record after applying one coalesced batch.
     *
     * @param recentLimit maximum size of the recent-changes ring
     * @param now         modification timestamp
     */
    public ChangeTrackingRecord apply(ChangeBatch batch, int recentLimit, Instant now) {
        if (!batch.getKey().equals(key())) {
            throw new IllegalArgumentException("Batch for " + batch.getKey() + " applied to record " + key());
        }
        long nextVersion = changeVersion + 1;

        Map<ChangeCategory, CategoryCounter> nextCounters = new EnumMap<>(ChangeCategory.class);
        nextCounters.putAll(counters);
        List<RecentChange> nextRecent = new ArrayList<>(recentChanges);

        for (ChangeCategory category : ChangeCategory.values()) {
            long increment = batch.count(category);
            if (increment == 0) {
                continue;
            }
            Instant changedAt = batch.getLastRequestedAt().getOrDefault(category, now);
            nextCounters.put(category, counter(category).add(increment, changedAt));
            nextRecent.add(new RecentChange(nextVersion, category, increment, changedAt));
        }

        int overflow = nextRecent.size() - Math.max(0, recentLimit);
        if (overflow > 0) {
            nextRecent = nextRecent.subList(overflow, nextRecent.size());
        }

        return toBuilder()
                .changeVersion(nextVersion)
                .counters(Collections.unmodifiableMap(nextCounters))
                .recentChanges(List.copyOf(nextRecent))
                .lastModified(now)
                .build();
    }
}
