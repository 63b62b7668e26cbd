package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.concurrency.VersionedRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A direct payment from one member to another, outside the expense flow.
 * Recording a suggested simplified debt creates one of these.
 */
@Value
@Builder(toBuilder = true)
public class Settlement implements VersionedRecord<Settlement> {
    UUID id;
    String groupId;
    String payerId;
    String payeeId;
    long amount;
    String currency;
    Instant date;
    String note;
    String createdBy;
    long version;
    Instant createdAt;
    Instant updatedAt;
    Instant deletedAt;
    String deletedBy;

    @Override
    public Settlement withVersion(long version, Instant updatedAt) {
        return toBuilder().version(version).updatedAt(updatedAt).build();
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public List<String> affectedMemberIds() {
        return List.of(payerId, payeeId);
    }

    public Settlement markDeleted(String deletedBy, Instant at) {
        if (isDeleted()) {
            throw new IllegalStateException("Settlement " + id + " is already deleted");
        }
        return toBuilder().deletedAt(at).deletedBy(deletedBy).build();
    }
}
