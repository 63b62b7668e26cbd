package com.flagship.split_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.balance.SimplifiedDebt;
import lombok.Value;

@Value
public class SimplifiedDebtResponse {

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    public static SimplifiedDebtResponse from(SimplifiedDebt debt) {
        return new SimplifiedDebtResponse(debt.getFrom(), debt.getTo(), debt.getAmount(), debt.getCurrency());
    }
}
