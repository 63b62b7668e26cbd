package com.flagship.split_ledger.expense;

import com.flagship.split_ledger.concurrency.VersionedRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Expense domain object.
 *
 * Immutable: every change produces a new instance through {@code toBuilder()}.
 * Invariant: the split amounts sum exactly to {@code amount}. Write paths
 * validate it; the balance calculator re-checks it on read.
 */
@Value
@Builder(toBuilder = true)
public class Expense implements VersionedRecord<Expense> {
    UUID id;
    String groupId;
    String description;
    String category;
    Instant date;
    String payerId;
    long amount;
    String currency;
    SplitType splitType;
    List<ExpenseSplit> splits;
    String createdBy;
    long version;
    Instant createdAt;
    Instant updatedAt;
    Instant deletedAt;
    String deletedBy;

    @Override
    public Expense withVersion(long version, Instant updatedAt) {
        return toBuilder().version(version).updatedAt(updatedAt).build();
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public List<String> participantIds() {
        return splits.stream().map(ExpenseSplit::getMemberId).toList();
    }

    /**
     * Members whose balance this expense moves: the payer and every split member.
     */
    public List<String> affectedMemberIds() {
        return Stream.concat(Stream.of(payerId), splits.stream().map(ExpenseSplit::getMemberId))
                .distinct()
                .toList();
    }

    public long splitTotal() {
        return splits.stream().mapToLong(ExpenseSplit::getAmount).sum();
    }

    /**
     * Marks the expense as deleted. Deleted expenses stay in the store and
     * are skipped by balance aggregation.
     */
    public Expense markDeleted(String deletedBy, Instant at) {
        if (isDeleted()) {
            throw new IllegalStateException("Expense " + id + " is already deleted");
        }
        return toBuilder().deletedAt(at).deletedBy(deletedBy).build();
    }
}
