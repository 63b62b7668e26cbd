package com.flagship.split_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.settlement.SettlementDraft;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Request DTO for recording a payment between two members.
 * {@code date} defaults to the time of recording.
 */
@Value
@Builder
@Jacksonized
public class CreateSettlementRequest {

    @NotBlank(message = "Payer is required")
    @JsonProperty("payer_id")
    String payerId;

    @NotBlank(message = "Payee is required")
    @JsonProperty("payee_id")
    String payeeId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("date")
    Instant date;

    @Size(max = 500, message = "Note must be at most 500 characters")
    @JsonProperty("note")
    String note;

    public SettlementDraft toDraft(String groupId) {
        return SettlementDraft.builder()
                .groupId(groupId)
                .payerId(payerId)
                .payeeId(payeeId)
                .amount(amount)
                .currency(currency)
                .date(date)
                .note(note)
                .build();
    }
}
