package com.flagship.split_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.expense.ExpenseDraft;
import com.flagship.split_ledger.expense.SplitType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for creating an expense. Amounts are integer minor units.
 */
@Value
@Builder
@Jacksonized
public class CreateExpenseRequest {

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotBlank(message = "Category is required")
    @JsonProperty("category")
    String category;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    Instant date;

    @NotBlank(message = "Payer is required")
    @JsonProperty("payer_id")
    String payerId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Split type is required")
    @JsonProperty("split_type")
    SplitType splitType;

    @NotEmpty(message = "At least one participant is required")
    @JsonProperty("participants")
    List<String> participants;

    @Valid
    @JsonProperty("splits")
    List<SplitRequest> splits;

    public ExpenseDraft toDraft(String groupId) {
        return ExpenseDraft.builder()
                .groupId(groupId)
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
