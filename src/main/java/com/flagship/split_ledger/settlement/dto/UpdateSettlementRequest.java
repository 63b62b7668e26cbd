package com.flagship.split_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.settlement.SettlementPatch;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Partial update. Sending an empty {@code note} removes it.
 */
@Value
@Builder
@Jacksonized
public class UpdateSettlementRequest {

    @JsonProperty("amount")
    Long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("note")
    String note;

    public SettlementPatch toPatch() {
        return SettlementPatch.builder()
                .amount(amount)
                .currency(currency)
                .date(date)
                .note(note)
                .build();
    }
}
