package com.flagship.split_ledger.expense;

import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.common.idempotency.IdempotentResult;
import com.flagship.split_ledger.common.web.RequestHeaders;
import com.flagship.split_ledger.expense.dto.CreateExpenseRequest;
import com.flagship.split_ledger.expense.dto.ExpenseResponse;
import com.flagship.split_ledger.expense.dto.UpdateExpenseRequest;
import com.flagship.split_ledger.member.GroupMemberService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for expenses.
 *
 * - {@code Idempotency-Key} (optional) makes creation safe to retry: a replay
 *   returns 200 with the original expense instead of 201
 * - {@code If-Match} (optional) pins update/delete to a version; without it
 *   the server retries conflicting writes on the latest version
 * - Responses carry the record version as {@code ETag}
 */
@RestController
@RequestMapping("/api/groups/{groupId}/expenses")
@RequiredArgsConstructor
@Slf4j
public class ExpenseController {

    private final ExpenseService expenseService;
    private final GroupMemberService memberService;

    @PostMapping
    public ResponseEntity<ExpenseResponse> createExpense(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody CreateExpenseRequest request) {

        log.info("Received expense creation request: groupId={}, amount={}, currency={}, splitType={}",
                groupId, request.getAmount(), request.getCurrency(), request.getSplitType());

        IdempotentResult<Expense> result = expenseService.createExpense(userId, request.toDraft(groupId), idempotencyKey);
        Expense expense = result.getRecord();
        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
                .eTag(RequestHeaders.etag(expense.getVersion()))
                .body(ExpenseResponse.from(expense));
    }

    @GetMapping
    public List<ExpenseResponse> listExpenses(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        memberService.requireActiveMember(groupId, userId);
        return expenseService.listGroupExpenses(groupId).stream().map(ExpenseResponse::from).toList();
    }

    @GetMapping("/{expenseId}")
    public ResponseEntity<ExpenseResponse> getExpense(
            @PathVariable("groupId") String groupId,
            @PathVariable("expenseId") UUID expenseId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        memberService.requireActiveMember(groupId, userId);
        Expense expense = inGroup(groupId, expenseService.getExpense(expenseId));
        return ResponseEntity.ok()
                .eTag(RequestHeaders.etag(expense.getVersion()))
                .body(ExpenseResponse.from(expense));
    }

    @PatchMapping("/{expenseId}")
    public ResponseEntity<ExpenseResponse> updateExpense(
            @PathVariable("groupId") String groupId,
            @PathVariable("expenseId") UUID expenseId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.IF_MATCH, required = false) String ifMatch,
            @Valid @RequestBody UpdateExpenseRequest request) {
        inGroup(groupId, expenseService.getExpense(expenseId));
        Expense updated = expenseService.updateExpense(
                expenseId, userId, request.toPatch(), RequestHeaders.expectedVersion(ifMatch));
        return ResponseEntity.ok()
                .eTag(RequestHeaders.etag(updated.getVersion()))
                .body(ExpenseResponse.from(updated));
    }

    @DeleteMapping("/{expenseId}")
    public ResponseEntity<Void> deleteExpense(
            @PathVariable("groupId") String groupId,
            @PathVariable("expenseId") UUID expenseId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.IF_MATCH, required = false) String ifMatch) {
        inGroup(groupId, expenseService.getExpense(expenseId));
        expenseService.deleteExpense(expenseId, userId, RequestHeaders.expectedVersion(ifMatch));
        return ResponseEntity.noContent().build();
    }

    private static Expense inGroup(String groupId, Expense expense) {
        if (!expense.getGroupId().equals(groupId)) {
            throw new RecordNotFoundException(ExpenseStore.RECORD_TYPE, expense.getId());
        }
        return expense;
    }
}
