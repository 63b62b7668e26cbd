package com.flagship.split_ledger.notification;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable accumulator for one key while its debounce timer is pending.
 *
 * Only touched inside {@code ConcurrentHashMap.compute} for its key, or by the
 * timer after it removed the entry from the map, so it needs no locking.
 */
final class PendingChange {

    private final ChangeKey key;
    private final Map<ChangeCategory, Long> counts = new EnumMap<>(ChangeCategory.class);
    private final Map<ChangeCategory, Instant> lastRequestedAt = new EnumMap<>(ChangeCategory.class);
    private int attempt;
    private ScheduledFuture<?> timer;

    PendingChange(ChangeKey key, int attempt) {
        this.key = key;
        this.attempt = attempt;
    }

    ChangeKey key() {
        return key;
    }

    void add(ChangeCategory category, long increment, Instant at) {
        counts.merge(category, increment, Math::addExact);
        lastRequestedAt.merge(category, at, (a, b) -> b.isAfter(a) ? b : a);
    }

    void absorb(ChangeBatch failed) {
        failed.getCounts().forEach((category, count) ->
                add(category, count, failed.getLastRequestedAt().get(category)));
        attempt = Math.max(attempt, failed.getAttempt() + 1);
    }

    void replaceTimer(ScheduledFuture<?> next) {
        if (timer != null) {
            timer.cancel(false);
        }
        timer = next;
    }

    void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    ChangeBatch snapshot() {
        return new ChangeBatch(key, counts, lastRequestedAt, attempt);
    }
}
