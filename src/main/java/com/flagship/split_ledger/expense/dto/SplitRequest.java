package com.flagship.split_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.expense.ExpenseDraft;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One caller-provided share: {@code amount} for exact splits,
 * {@code percentage_bp} (basis points, 10000 = 100%) for percentage splits.
 */
@Value
@Builder
@Jacksonized
public class SplitRequest {

    @NotBlank(message = "Split member is required")
    @JsonProperty("member_id")
    String memberId;

    @JsonProperty("amount")
    Long amount;

    @JsonProperty("percentage_bp")
    Integer percentageBasisPoints;

    public ExpenseDraft.SplitInput toInput() {
        return new ExpenseDraft.SplitInput(memberId, amount, percentageBasisPoints);
    }
}
