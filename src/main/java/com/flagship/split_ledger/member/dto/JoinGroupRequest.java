package com.flagship.split_ledger.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The joining user is the caller ({@code X-User-Id}); the body only carries presentation.
 */
@Value
@Builder
@Jacksonized
public class JoinGroupRequest {

    @NotBlank(message = "Display name is required")
    @Size(max = 100, message = "Display name must be at most 100 characters")
    @JsonProperty("display_name")
    String displayName;

    @Size(max = 100, message = "Group display name must be at most 100 characters")
    @JsonProperty("group_display_name")
    String groupDisplayName;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Theme color must be a hex color like #1A2B3C")
    @JsonProperty("theme_color")
    String themeColor;
}
