package com.flagship.split_ledger.comment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.comment.CommentPage;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CommentPageResponse {

    @JsonProperty("comments")
    List<CommentResponse> comments;

    @JsonProperty("has_more")
    boolean hasMore;

    @JsonProperty("next_cursor")
    String nextCursor;

    public static CommentPageResponse from(CommentPage page) {
        return CommentPageResponse.builder()
                .comments(page.getComments().stream().map(CommentResponse::from).toList())
                .hasMore(page.isHasMore())
                .nextCursor(page.getNextCursor())
                .build();
    }
}
