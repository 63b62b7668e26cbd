package com.flagship.split_ledger.expense;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Unvalidated expense content, either from a create request or from an
 * existing expense with an update patch applied. Splits are not computed yet:
 * {@code splitInputs} carries what the caller gave for EXACT and PERCENTAGE.
 */
@Value
@Builder(toBuilder = true)
public class ExpenseDraft {
    String groupId;
    String description;
    String category;
    Instant date;
    String payerId;
    long amount;
    String currency;
    SplitType splitType;
    List<String> participants;
    List<SplitInput> splitInputs;

    @Value
    public static class SplitInput {
        String memberId;
        Long amount;
        Integer basisPoints;
    }

    /**
     * Draft matching an existing expense, used as the base for a patch.
     */
    public static ExpenseDraft from(Expense expense) {
        return ExpenseDraft.builder()
                .groupId(expense.getGroupId())
                .description(expense.getDescription())
                .category(expense.getCategory())
                .date(expense.getDate())
                .payerId(expense.getPayerId())
                .amount(expense.getAmount())
                .currency(expense.getCurrency())
                .splitType(expense.getSplitType())
                .participants(expense.participantIds())
                .splitInputs(expense.getSplits().stream()
                        .map(s -> new SplitInput(s.getMemberId(), s.getAmount(), s.getPercentageBasisPoints()))
                        .toList())
                .build();
    }
}
