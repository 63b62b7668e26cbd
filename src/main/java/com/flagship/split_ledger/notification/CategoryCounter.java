package com.flagship.split_ledger.notification;

import lombok.Value;

import java.time.Instant;

/**
 * Monotonic counter for one change category.
 */
@Value
public class CategoryCounter {

    public static final CategoryCounter ZERO = new CategoryCounter(0, null);

    long count;
    Instant lastChangedAt;

    /**
     * @throws IllegalArgumentException if {@code increment} is negative
     */
    public CategoryCounter add(long increment, Instant changedAt) {
        if (increment < 0) {
            throw new IllegalArgumentException("Counter increment must not be negative: " + increment);
        }
        if (increment == 0) {
            return this;
        }
        Instant latest = lastChangedAt == null || changedAt.isAfter(lastChangedAt) ? changedAt : lastChangedAt;
        return new CategoryCounter(Math.addExact(count, increment), latest);
    }
}
