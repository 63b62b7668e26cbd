package com.flagship.split_ledger.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The creator is the caller ({@code X-User-Id}). {@code display_name} names
 * their membership and defaults to the user id.
 */
@Value
@Builder
@Jacksonized
public class CreateGroupRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @JsonProperty("name")
    String name;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;

    @Size(max = 100, message = "Display name must be at most 100 characters")
    @JsonProperty("display_name")
    String displayName;
}
