package com.flagship.split_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.group.GroupPatch;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Partial update. Sending an empty {@code description} removes it.
 */
@Value
@Builder
@Jacksonized
public class UpdateGroupRequest {

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    public GroupPatch toPatch() {
        return GroupPatch.builder()
                .name(name)
                .description(description)
                .build();
    }
}
