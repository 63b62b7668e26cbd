package com.flagship.split_ledger.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for group membership.
 *
 * No setters: the only state changes are {@link #leave(Instant)} and
 * {@link #rejoin(GroupMember, Instant)}. Group and user ids are immutable.
 */
@Entity
@Table(
    name = "group_members",
    uniqueConstraints = @UniqueConstraint(name = "uk_group_members_group_user", columnNames = {"group_id", "user_id"}),
    indexes = @Index(name = "idx_group_members_user", columnList = "user_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GroupMemberEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "group_id", nullable = false, updatable = false)
    private String groupId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Column(name = "group_display_name")
    private String groupDisplayName;

    @Column(name = "theme_color", length = 16)
    private String themeColor;

    @Column(name = "joined_at", nullable = false)
    private Instant joinedAt;

    @Column(name = "left_at")
    private Instant leftAt;

    static GroupMemberEntity fromDomain(GroupMember member) {
        return new GroupMemberEntity(
            UUID.randomUUID(),
            member.getGroupId(),
            member.getUserId(),
            member.getDisplayName(),
            member.getGroupDisplayName(),
            member.getThemeColor(),
            member.getJoinedAt(),
            member.getLeftAt()
        );
    }

    public GroupMember toDomain() {
        return GroupMember.builder()
            .groupId(groupId)
            .userId(userId)
            .displayName(displayName)
            .groupDisplayName(groupDisplayName)
            .themeColor(themeColor)
            .joinedAt(joinedAt)
            .leftAt(leftAt)
            .build();
    }

    boolean isActive() {
        return leftAt == null;
    }

    void leave(Instant at) {
        if (leftAt != null) {
            throw new IllegalStateException("Member " + userId + " already left group " + groupId);
        }
        this.leftAt = at;
    }

    /**
     * Reactivates a departed membership, taking the profile fields from the new join request.
     */
    void rejoin(GroupMember member, Instant at) {
        if (leftAt == null) {
            throw new IllegalStateException("Member " + userId + " is already active in group " + groupId);
        }
        this.displayName = member.getDisplayName();
        this.groupDisplayName = member.getGroupDisplayName();
        this.themeColor = member.getThemeColor();
        this.joinedAt = at;
        this.leftAt = null;
    }
}
