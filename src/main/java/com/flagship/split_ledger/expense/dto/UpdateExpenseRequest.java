package com.flagship.split_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.expense.ExpensePatch;
import com.flagship.split_ledger.expense.SplitType;
import jakarta.validation.Valid;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Partial update. Absent fields keep their current value.
 */
@Value
@Builder
@Jacksonized
public class UpdateExpenseRequest {

    @JsonProperty("description")
    String description;

    @JsonProperty("category")
    String category;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("payer_id")
    String payerId;

    @JsonProperty("amount")
    Long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("split_type")
    SplitType splitType;

    @JsonProperty("participants")
    List<String> participants;

    @Valid
    @JsonProperty("splits")
    List<SplitRequest> splits;

    public ExpensePatch toPatch() {
        return ExpensePatch.builder()
                .description(description)
                .category(category)
                .date(date)
                .payerId(payerId)
                .amount(amount)
                .currency(currency)
                .splitType(splitType)
                .participants(participants)
                .splitInputs(splits == null ? null : splits.stream().map(SplitRequest::toInput).toList())
                .build();
    }
}
