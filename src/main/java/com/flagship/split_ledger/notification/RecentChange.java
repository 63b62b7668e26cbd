package com.flagship.split_ledger.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * Entry of the bounded recent-changes ring: which category moved, by how
 * many coalesced requests, and when the last of them was made.
 */
@Value
public class RecentChange {

    @JsonProperty("change_version")
    long changeVersion;

    @JsonProperty("category")
    ChangeCategory category;

    @JsonProperty("count")
    long count;

    @JsonProperty("changed_at")
    Instant changedAt;

    @JsonCreator
    public RecentChange(@JsonProperty("change_version") long changeVersion,
                        @JsonProperty("category") ChangeCategory category,
                        @JsonProperty("count") long count,
                        @JsonProperty("changed_at") Instant changedAt) {
        this.changeVersion = changeVersion;
        this.category = category;
        this.count = count;
        this.changedAt = changedAt;
    }
}
