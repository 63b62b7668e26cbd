package com.flagship.split_ledger.comment;

import lombok.Value;

import java.util.List;

/**
 * One page of a comment thread, newest first. {@code nextCursor} is null on the last page.
 */
@Value
public class CommentPage {
    List<Comment> comments;
    boolean hasMore;
    String nextCursor;
}
