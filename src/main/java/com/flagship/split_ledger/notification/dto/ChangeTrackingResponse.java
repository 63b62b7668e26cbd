package com.flagship.split_ledger.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.notification.CategoryCounter;
import com.flagship.split_ledger.notification.ChangeCategory;
import com.flagship.split_ledger.notification.ChangeTrackingRecord;
import com.flagship.split_ledger.notification.RecentChange;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a client compares against its cached state: when {@code change_version}
 * moved, the per-category counters say which views need a refetch.
 * Every category is always present, with a zero count if it never changed.
 */
@Value
@Builder
public class ChangeTrackingResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("group_id")
    String groupId;

    @JsonProperty("change_version")
    long changeVersion;

    @JsonProperty("categories")
    Map<ChangeCategory, Counter> categories;

    @JsonProperty("recent_changes")
    List<RecentChange> recentChanges;

    @JsonProperty("last_modified")
    Instant lastModified;

    @Value
    public static class Counter {
        @JsonProperty("count")
        long count;

        @JsonProperty("last_changed_at")
        Instant lastChangedAt;
    }

    public static ChangeTrackingResponse from(ChangeTrackingRecord record) {
        Map<ChangeCategory, Counter> categories = new LinkedHashMap<>();
        for (ChangeCategory category : ChangeCategory.values()) {
            CategoryCounter counter = record.counter(category);
            categories.put(category, new Counter(counter.getCount(), counter.getLastChangedAt()));
        }
        return ChangeTrackingResponse.builder()
                .userId(record.getUserId())
                .groupId(record.getGroupId())
                .changeVersion(record.getChangeVersion())
                .categories(categories)
                .recentChanges(record.getRecentChanges())
                .lastModified(record.getLastModified())
                .build();
    }
}
