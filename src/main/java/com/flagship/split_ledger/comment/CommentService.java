package com.flagship.split_ledger.comment;

import com.flagship.split_ledger.common.exception.LedgerValidationException;
import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.common.exception.StoreUnavailableException;
import com.flagship.split_ledger.expense.Expense;
import com.flagship.split_ledger.expense.ExpenseService;
import com.flagship.split_ledger.expense.ExpenseStore;
import com.flagship.split_ledger.member.GroupMember;
import com.flagship.split_ledger.member.GroupMemberService;
import com.flagship.split_ledger.notification.ChangeCategory;
import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Comments on groups and expenses.
 *
 * Rules:
 * - Only active members read or write a group's threads
 * - Expense threads exist only for live expenses of the same group
 * - Text is trimmed and must be 1 to {@value #MAX_TEXT_LENGTH} characters
 * - Every new comment bumps COMMENT for the group's active members
 */
@Service
@Slf4j
public class CommentService {

    public static final int MAX_TEXT_LENGTH = 500;
    public static final int DEFAULT_PAGE_SIZE = 8;
    public static final int MAX_PAGE_SIZE = 100;

    private final CommentStore store;
    private final GroupMemberService memberService;
    private final ExpenseService expenseService;
    private final ChangeNotificationTracker tracker;
    private final Clock clock;

    public CommentService(CommentStore store,
                          GroupMemberService memberService,
                          ExpenseService expenseService,
                          ChangeNotificationTracker tracker,
                          Clock clock) {
        this.store = store;
        this.memberService = memberService;
        this.expenseService = expenseService;
        this.tracker = tracker;
        this.clock = clock;
    }

    public Comment createGroupComment(String groupId, String authorId, String text) {
        return create(groupId, null, authorId, text);
    }

    /**
     * @throws RecordNotFoundException if the expense is deleted or belongs to another group
     */
    public Comment createExpenseComment(String groupId, UUID expenseId, String authorId, String text) {
        memberService.requireActiveMember(groupId, authorId);
        requireExpenseInGroup(groupId, expenseId);
        return create(groupId, expenseId, authorId, text);
    }

    /**
     * @param limit  page size, defaults to {@value #DEFAULT_PAGE_SIZE} and is capped at {@value #MAX_PAGE_SIZE}
     * @param cursor {@code nextCursor} of the previous page, or null for the newest comments
     */
    public CommentPage listGroupComments(String groupId, String userId, Integer limit, String cursor) {
        memberService.requireActiveMember(groupId, userId);
        return page(groupId, null, limit, cursor);
    }

    public CommentPage listExpenseComments(String groupId, UUID expenseId, String userId,
                                           Integer limit, String cursor) {
        memberService.requireActiveMember(groupId, userId);
        requireExpenseInGroup(groupId, expenseId);
        return page(groupId, expenseId, limit, cursor);
    }

    private Comment create(String groupId, UUID expenseId, String authorId, String text) {
        MDC.put("groupId", groupId);
        try {
            GroupMember author = memberService.getActiveMember(groupId, authorId);
            String trimmed = text == null ? "" : text.trim();
            if (trimmed.isEmpty() || trimmed.length() > MAX_TEXT_LENGTH) {
                throw new LedgerValidationException("INVALID_COMMENT",
                        "Comment must be between 1 and " + MAX_TEXT_LENGTH + " characters");
            }

            Comment comment = Comment.builder()
                    .id(UUID.randomUUID())
                    .groupId(groupId)
                    .expenseId(expenseId)
                    .authorId(authorId)
                    .authorName(author.effectiveName())
                    .text(trimmed)
                    .createdAt(clock.instant().truncatedTo(ChronoUnit.MICROS))
                    .build();
            try {
                store.insert(comment);
            } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
                throw new StoreUnavailableException("Could not store comment", e);
            }

            tracker.notify(memberService.listActiveMemberIds(groupId), groupId, ChangeCategory.COMMENT);
            log.info("Comment created: target={}, author={}, length={}",
                    expenseId == null ? "group" : "expense " + expenseId, authorId, trimmed.length());
            return comment;
        } finally {
            MDC.remove("groupId");
        }
    }

    private CommentPage page(String groupId, UUID expenseId, Integer limit, String cursor) {
        int size = limit == null ? DEFAULT_PAGE_SIZE : Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        CommentCursor after = cursor == null || cursor.isBlank() ? null : CommentCursor.decode(cursor);

        List<Comment> rows = store.listThread(groupId, expenseId, after, size + 1);
        boolean hasMore = rows.size() > size;
        List<Comment> comments = hasMore ? rows.subList(0, size) : rows;
        String nextCursor = hasMore ? CommentCursor.after(comments.get(size - 1)).encode() : null;
        return new CommentPage(List.copyOf(comments), hasMore, nextCursor);
    }

    private void requireExpenseInGroup(String groupId, UUID expenseId) {
        Expense expense = expenseService.getExpense(expenseId);
        if (!expense.getGroupId().equals(groupId)) {
            throw new RecordNotFoundException(ExpenseStore.RECORD_TYPE, expenseId);
        }
    }
}
