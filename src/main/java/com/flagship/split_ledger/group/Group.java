package com.flagship.split_ledger.group;

import com.flagship.split_ledger.concurrency.VersionedRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A shared-expense group. The member who created it owns its details.
 */
@Value
@Builder(toBuilder = true)
public class Group implements VersionedRecord<Group> {
    UUID id;
    String name;
    String description;
    String createdBy;
    long version;
    Instant createdAt;
    Instant updatedAt;

    @Override
    public String getGroupId() {
        return id.toString();
    }

    @Override
    public Group withVersion(long version, Instant updatedAt) {
        return toBuilder().version(version).updatedAt(updatedAt).build();
    }
}
