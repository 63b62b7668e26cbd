package com.flagship.split_ledger.group;

import lombok.Builder;
import lombok.Value;

/**
 * Partial update of a group's details. An empty description clears it.
 */
@Value
@Builder
public class GroupPatch {
    String name;
    String description;

    public boolean isEmpty() {
        return name == null && description == null;
    }

    public Group applyTo(Group base) {
        Group.GroupBuilder next = base.toBuilder();
        if (name != null) {
            next.name(name.trim());
        }
        if (description != null) {
            next.description(description.isBlank() ? null : description.trim());
        }
        return next.build();
    }
}
