package com.flagship.split_ledger.member;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Membership of one user in one group.
 *
 * The user id is opaque and never changes. Leaving marks {@code leftAt};
 * re-joining clears it again, so a membership row is never deleted.
 */
@Value
@Builder(toBuilder = true)
public class GroupMember {
    String groupId;
    String userId;
    String displayName;
    String groupDisplayName;
    String themeColor;
    Instant joinedAt;
    Instant leftAt;

    public boolean isActive() {
        return leftAt == null;
    }

    /**
     * Name shown inside the group: the per-group override if set, otherwise the global display name.
     */
    public String effectiveName() {
        return groupDisplayName != null && !groupDisplayName.isBlank() ? groupDisplayName : displayName;
    }
}
