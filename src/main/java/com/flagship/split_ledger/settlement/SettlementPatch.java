package com.flagship.split_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Partial update of a settlement. Payer and payee are fixed once recorded;
 * an empty note clears it.
 */
@Value
@Builder
public class SettlementPatch {
    Long amount;
    String currency;
    Instant date;
    String note;

    public boolean isEmpty() {
        return amount == null && currency == null && date == null && note == null;
    }

    public SettlementDraft applyTo(SettlementDraft base) {
        SettlementDraft.SettlementDraftBuilder next = base.toBuilder();
        if (amount != null) {
            next.amount(amount);
        }
        if (currency != null) {
            next.currency(currency);
        }
        if (date != null) {
            next.date(date);
        }
        if (note != null) {
            next.note(note.isBlank() ? null : note.trim());
        }
        return next.build();
    }
}
