package com.flagship.split_ledger.expense;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of an expense. Null fields keep their current value.
 */
@Value
@Builder
public class ExpensePatch {
    String description;
    String category;
    Instant date;
    String payerId;
    Long amount;
    String currency;
    SplitType splitType;
    List<String> participants;
    List<ExpenseDraft.SplitInput> splitInputs;

    public boolean isEmpty() {
        return description == null && category == null && date == null && payerId == null
                && amount == null && currency == null && splitType == null
                && participants == null && splitInputs == null;
    }

    public ExpenseDraft applyTo(ExpenseDraft base) {
        ExpenseDraft.ExpenseDraftBuilder next = base.toBuilder();
        if (description != null) {
            next.description(description.trim());
        }
        if (category != null) {
            next.category(category.trim());
        }
        if (date != null) {
            next.date(date);
        }
        if (payerId != null) {
            next.payerId(payerId);
        }
        if (amount != null) {
            next.amount(amount);
        }
        if (currency != null) {
            next.currency(currency);
        }
        if (splitType != null) {
            next.splitType(splitType);
        }
        if (participants != null) {
            next.participants(participants);
        }
        if (splitInputs != null) {
            next.splitInputs(splitInputs);
        }
        return next.build();
    }
}
