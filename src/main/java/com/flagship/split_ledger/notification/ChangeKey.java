package com.flagship.split_ledger.notification;

import lombok.Value;

/**
 * Debounce and storage key: one change-tracking record per (user, group).
 */
@Value
public class ChangeKey {
    String userId;
    String groupId;

    public static ChangeKey of(String userId, String groupId) {
        if (userId == null || userId.isBlank() || groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("userId and groupId are required");
        }
        return new ChangeKey(userId, groupId);
    }

    @Override
    public String toString() {
        return userId + ":" + groupId;
    }
}
