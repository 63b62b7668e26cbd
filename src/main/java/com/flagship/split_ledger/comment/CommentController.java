package com.flagship.split_ledger.comment;

import com.flagship.split_ledger.comment.dto.CommentPageResponse;
import com.flagship.split_ledger.comment.dto.CommentResponse;
import com.flagship.split_ledger.comment.dto.CreateCommentRequest;
import com.flagship.split_ledger.common.web.RequestHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Group and expense comment threads. Lists are newest first and paged with
 * the opaque {@code next_cursor} of the previous page.
 */
@RestController
@RequestMapping("/api/groups/{groupId}")
@RequiredArgsConstructor
public class CommentController {

    private final CommentService commentService;

    @PostMapping("/comments")
    public ResponseEntity<CommentResponse> createGroupComment(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @Valid @RequestBody CreateCommentRequest request) {
        Comment comment = commentService.createGroupComment(groupId, userId, request.getText());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommentResponse.from(comment));
    }

    @GetMapping("/comments")
    public CommentPageResponse listGroupComments(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "cursor", required = false) String cursor) {
        return CommentPageResponse.from(commentService.listGroupComments(groupId, userId, limit, cursor));
    }

    @PostMapping("/expenses/{expenseId}/comments")
    public ResponseEntity<CommentResponse> createExpenseComment(
            @PathVariable("groupId") String groupId,
            @PathVariable("expenseId") UUID expenseId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @Valid @RequestBody CreateCommentRequest request) {
        Comment comment = commentService.createExpenseComment(groupId, expenseId, userId, request.getText());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommentResponse.from(comment));
    }

    @GetMapping("/expenses/{expenseId}/comments")
    public CommentPageResponse listExpenseComments(
            @PathVariable("groupId") String groupId,
            @PathVariable("expenseId") UUID expenseId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "cursor", required = false) String cursor) {
        return CommentPageResponse.from(commentService.listExpenseComments(groupId, expenseId, userId, limit, cursor));
    }
}
