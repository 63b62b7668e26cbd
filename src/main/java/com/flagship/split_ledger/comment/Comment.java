package com.flagship.split_ledger.comment;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A comment on a group, or on one of its expenses when {@code expenseId} is set.
 * The author's name is captured when the comment is written.
 */
@Value
@Builder
public class Comment {
    UUID id;
    String groupId;
    UUID expenseId;
    String authorId;
    String authorName;
    String text;
    Instant createdAt;
}
