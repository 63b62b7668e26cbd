package com.flagship.split_ledger.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Payload published to the change-notifications topic after a tracking record
 * moved to a new change version. Push layers forward it to the user's devices.
 */
@Value
@Builder
public class ChangeVersionEvent {

    public static final String EVENT_TYPE = "ChangeVersionBumped";
    public static final String AGGREGATE_TYPE = "ChangeTracking";

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("group_id")
    String groupId;

    @JsonProperty("change_version")
    long changeVersion;

    @JsonProperty("counts")
    Map<ChangeCategory, Long> counts;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    public static ChangeVersionEvent from(ChangeTrackingRecord record) {
        Map<ChangeCategory, Long> counts = new EnumMap<>(ChangeCategory.class);
        for (ChangeCategory category : ChangeCategory.values()) {
            counts.put(category, record.counter(category).getCount());
        }
        return ChangeVersionEvent.builder()
                .userId(record.getUserId())
                .groupId(record.getGroupId())
                .changeVersion(record.getChangeVersion())
                .counts(counts)
                .occurredAt(record.getLastModified())
                .build();
    }
}
