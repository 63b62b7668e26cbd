package com.flagship.split_ledger.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Row of {@code change_tracking_records}: one per (user, group), one column
 * pair per {@link ChangeCategory}.
 *
 * The JPA {@code @Version} guards against two application instances flushing
 * the same key at once; the loser fails and its batch is re-queued by the tracker.
 */
@Entity
@Table(
    name = "change_tracking_records",
    uniqueConstraints = @UniqueConstraint(name = "uk_change_tracking_user_group", columnNames = {"user_id", "group_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ChangeTrackingEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "group_id", nullable = false, updatable = false)
    private String groupId;

    @Column(name = "change_version", nullable = false)
    private long changeVersion;

    @Column(name = "transaction_count", nullable = false)
    private long transactionCount;

    @Column(name = "transaction_changed_at")
    private Instant transactionChangedAt;

    @Column(name = "balance_count", nullable = false)
    private long balanceCount;

    @Column(name = "balance_changed_at")
    private Instant balanceChangedAt;

    @Column(name = "group_details_count", nullable = false)
    private long groupDetailsCount;

    @Column(name = "group_details_changed_at")
    private Instant groupDetailsChangedAt;

    @Column(name = "comment_count", nullable = false)
    private long commentCount;

    @Column(name = "comment_changed_at")
    private Instant commentChangedAt;

    @Column(name = "recent_changes", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String recentChanges;

    @Column(name = "last_modified")
    private Instant lastModified;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    static ChangeTrackingEntity fromDomain(ChangeTrackingRecord record, String recentChangesJson) {
        ChangeTrackingEntity entity = new ChangeTrackingEntity();
        entity.id = UUID.randomUUID();
        entity.userId = record.getUserId();
        entity.groupId = record.getGroupId();
        entity.updateFromDomain(record, recentChangesJson);
        return entity;
    }

    /**
     * Copies counters and ring from the domain record. Identity columns are never touched.
     */
    void updateFromDomain(ChangeTrackingRecord record, String recentChangesJson) {
        if (record.getChangeVersion() < changeVersion) {
            throw new IllegalStateException("Change version of " + userId + ":" + groupId
                    + " would go back from " + changeVersion + " to " + record.getChangeVersion());
        }
        this.changeVersion = record.getChangeVersion();
        this.transactionCount = record.counter(ChangeCategory.TRANSACTION).getCount();
        this.transactionChangedAt = record.counter(ChangeCategory.TRANSACTION).getLastChangedAt();
        this.balanceCount = record.counter(ChangeCategory.BALANCE).getCount();
        this.balanceChangedAt = record.counter(ChangeCategory.BALANCE).getLastChangedAt();
        this.groupDetailsCount = record.counter(ChangeCategory.GROUP_DETAILS).getCount();
        this.groupDetailsChangedAt = record.counter(ChangeCategory.GROUP_DETAILS).getLastChangedAt();
        this.commentCount = record.counter(ChangeCategory.COMMENT).getCount();
        this.commentChangedAt = record.counter(ChangeCategory.COMMENT).getLastChangedAt();
        this.recentChanges = recentChangesJson;
        this.lastModified = record.getLastModified();
    }

    ChangeTrackingRecord toDomain(List<RecentChange> parsedRecentChanges) {
        Map<ChangeCategory, CategoryCounter> counters = new EnumMap<>(ChangeCategory.class);
        counters.put(ChangeCategory.TRANSACTION, new CategoryCounter(transactionCount, transactionChangedAt));
        counters.put(ChangeCategory.BALANCE, new CategoryCounter(balanceCount, balanceChangedAt));
        counters.put(ChangeCategory.GROUP_DETAILS, new CategoryCounter(groupDetailsCount, groupDetailsChangedAt));
        counters.put(ChangeCategory.COMMENT, new CategoryCounter(commentCount, commentChangedAt));
        return ChangeTrackingRecord.builder()
                .userId(userId)
                .groupId(groupId)
                .changeVersion(changeVersion)
                .counters(counters)
                .recentChanges(List.copyOf(parsedRecentChanges))
                .lastModified(lastModified)
                .build();
    }
}
