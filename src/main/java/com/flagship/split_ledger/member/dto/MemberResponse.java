package com.flagship.split_ledger.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.member.GroupMember;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MemberResponse {

    @JsonProperty("group_id")
    String groupId;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("display_name")
    String displayName;

    @JsonProperty("effective_name")
    String effectiveName;

    @JsonProperty("theme_color")
    String themeColor;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("joined_at")
    Instant joinedAt;

    @JsonProperty("left_at")
    Instant leftAt;

    public static MemberResponse from(GroupMember member) {
        return MemberResponse.builder()
                .groupId(member.getGroupId())
                .userId(member.getUserId())
                .displayName(member.getDisplayName())
                .effectiveName(member.effectiveName())
                .themeColor(member.getThemeColor())
                .active(member.isActive())
                .joinedAt(member.getJoinedAt())
                .leftAt(member.getLeftAt())
                .build();
    }
}
