package com.flagship.split_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.group.Group;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class GroupResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("version")
    long version;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static GroupResponse from(Group group) {
        return GroupResponse.builder()
                .id(group.getGroupId())
                .name(group.getName())
                .description(group.getDescription())
                .createdBy(group.getCreatedBy())
                .version(group.getVersion())
                .createdAt(group.getCreatedAt())
                .updatedAt(group.getUpdatedAt())
                .build();
    }
}
