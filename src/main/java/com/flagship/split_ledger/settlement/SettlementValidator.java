package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.common.exception.LedgerValidationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class SettlementValidator {

    /** 999 999.99 in a two-decimal currency. */
    public static final long MAX_AMOUNT = 99_999_999L;
    public static final int MAX_NOTE_LENGTH = 500;

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");
    private static final Duration CLOCK_SKEW = Duration.ofMinutes(5);

    /**
     * @throws LedgerValidationException on the first rule broken
     */
    public void validate(SettlementDraft draft, Set<String> activeMembers, Instant now) {
        if (draft.getAmount() <= 0) {
            throw new LedgerValidationException("INVALID_AMOUNT", "Amount must be greater than 0");
        }
        if (draft.getAmount() > MAX_AMOUNT) {
            throw new LedgerValidationException("INVALID_AMOUNT", "Amount cannot exceed " + MAX_AMOUNT + " minor units");
        }
        if (draft.getCurrency() == null || !CURRENCY.matcher(draft.getCurrency()).matches()) {
            throw new LedgerValidationException("INVALID_CURRENCY", "Currency must be a 3-letter ISO code");
        }
        if (isBlank(draft.getPayerId()) || isBlank(draft.getPayeeId())) {
            throw new LedgerValidationException("MISSING_PARTY", "Payer and payee are required");
        }
        if (draft.getPayerId().equals(draft.getPayeeId())) {
            throw new LedgerValidationException("SAME_PAYER_PAYEE", "Payer and payee must be different members");
        }
        if (draft.getDate() != null && draft.getDate().isAfter(now.plus(CLOCK_SKEW))) {
            throw new LedgerValidationException("INVALID_DATE", "Date cannot be in the future");
        }
        if (draft.getNote() != null && draft.getNote().length() > MAX_NOTE_LENGTH) {
            throw new LedgerValidationException("INVALID_NOTE", "Note must be at most " + MAX_NOTE_LENGTH + " characters");
        }

        List<String> unknown = new ArrayList<>();
        for (String memberId : List.of(draft.getPayerId(), draft.getPayeeId())) {
            if (!activeMembers.contains(memberId)) {
                unknown.add(memberId);
            }
        }
        if (!unknown.isEmpty()) {
            throw new LedgerValidationException("UNKNOWN_MEMBER", "Not active members of the group: " + unknown);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
