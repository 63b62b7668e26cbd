package com.flagship.split_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Unvalidated settlement content from a create request, or an existing
 * settlement with an update patch applied.
 */
@Value
@Builder(toBuilder = true)
public class SettlementDraft {
    String groupId;
    String payerId;
    String payeeId;
    long amount;
    String currency;
    Instant date;
    String note;

    public static SettlementDraft from(Settlement settlement) {
        return SettlementDraft.builder()
                .groupId(settlement.getGroupId())
                .payerId(settlement.getPayerId())
                .payeeId(settlement.getPayeeId())
                .amount(settlement.getAmount())
                .currency(settlement.getCurrency())
                .date(settlement.getDate())
                .note(settlement.getNote())
                .build();
    }
}
