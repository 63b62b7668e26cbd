package com.flagship.split_ledger.comment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.comment.Comment;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CommentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("group_id")
    String groupId;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("expense_id")
    UUID expenseId;

    @JsonProperty("author_id")
    String authorId;

    @JsonProperty("author_name")
    String authorName;

    @JsonProperty("text")
    String text;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CommentResponse from(Comment comment) {
        return CommentResponse.builder()
                .id(comment.getId())
                .groupId(comment.getGroupId())
                .expenseId(comment.getExpenseId())
                .authorId(comment.getAuthorId())
                .authorName(comment.getAuthorName())
                .text(comment.getText())
                .createdAt(comment.getCreatedAt())
                .build();
    }
}
