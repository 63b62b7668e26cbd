package com.flagship.split_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.expense.Expense;
import com.flagship.split_ledger.expense.ExpenseSplit;
import com.flagship.split_ledger.expense.SplitType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("group_id")
    String groupId;

    @JsonProperty("description")
    String description;

    @JsonProperty("category")
    String category;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("payer_id")
    String payerId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("split_type")
    SplitType splitType;

    @JsonProperty("splits")
    List<Split> splits;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("version")
    long version;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @Value
    public static class Split {
        @JsonProperty("member_id")
        String memberId;

        @JsonProperty("amount")
        long amount;

        @JsonProperty("percentage_bp")
        Integer percentageBasisPoints;

        static Split from(ExpenseSplit split) {
            return new Split(split.getMemberId(), split.getAmount(), split.getPercentageBasisPoints());
        }
    }

    public static ExpenseResponse from(Expense expense) {
        return ExpenseResponse.builder()
                .id(expense.getId())
                .groupId(expense.getGroupId())
                .description(expense.getDescription())
                .category(expense.getCategory())
                .date(expense.getDate())
                .payerId(expense.getPayerId())
                .amount(expense.getAmount())
                .currency(expense.getCurrency())
                .splitType(expense.getSplitType())
                .splits(expense.getSplits().stream().map(Split::from).toList())
                .createdBy(expense.getCreatedBy())
                .version(expense.getVersion())
                .createdAt(expense.getCreatedAt())
                .updatedAt(expense.getUpdatedAt())
                .build();
    }
}
