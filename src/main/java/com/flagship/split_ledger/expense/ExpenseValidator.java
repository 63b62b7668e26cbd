package com.flagship.split_ledger.expense;

import com.flagship.split_ledger.common.exception.LedgerValidationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Write-time rules for expenses. Runs before any store access, so a rejected
 * draft never leaves a partial write behind.
 */
@Component
public class ExpenseValidator {

    /** Keeps {@code amount * basisPoints} inside a long. */
    public static final long MAX_AMOUNT = Long.MAX_VALUE / SplitCalculator.FULL_BASIS_POINTS;
    public static final int MAX_DESCRIPTION_LENGTH = 200;
    public static final int MAX_CATEGORY_LENGTH = 50;
    public static final long MAX_AGE_YEARS = 10;

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");
    private static final Duration CLOCK_SKEW = Duration.ofMinutes(5);

    /**
     * @param activeMembers active member ids of the draft's group
     * @param now           reference time for the date range check
     * @throws LedgerValidationException on the first rule broken
     */
    public void validate(ExpenseDraft draft, Set<String> activeMembers, Instant now) {
        if (draft.getAmount() <= 0 || draft.getAmount() > MAX_AMOUNT) {
            throw new LedgerValidationException("INVALID_AMOUNT", "Amount must be a positive number of minor units");
        }
        if (draft.getCurrency() == null || !CURRENCY.matcher(draft.getCurrency()).matches()) {
            throw new LedgerValidationException("INVALID_CURRENCY", "Currency must be a 3-letter ISO code");
        }
        if (isBlank(draft.getDescription()) || draft.getDescription().length() > MAX_DESCRIPTION_LENGTH) {
            throw new LedgerValidationException("INVALID_DESCRIPTION",
                    "Description must be between 1 and " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (isBlank(draft.getCategory()) || draft.getCategory().length() > MAX_CATEGORY_LENGTH) {
            throw new LedgerValidationException("INVALID_CATEGORY",
                    "Category must be between 1 and " + MAX_CATEGORY_LENGTH + " characters");
        }
        validateDate(draft.getDate(), now);
        if (draft.getSplitType() == null) {
            throw new LedgerValidationException("INVALID_SPLIT_TYPE", "Split type must be equal, exact, or percentage");
        }

        List<String> participants = draft.getParticipants();
        if (participants == null || participants.isEmpty()) {
            throw new LedgerValidationException("INVALID_PARTICIPANTS", "At least one participant is required");
        }
        if (new HashSet<>(participants).size() != participants.size()) {
            throw new LedgerValidationException("DUPLICATE_PARTICIPANTS", "Each participant can only appear once");
        }
        if (isBlank(draft.getPayerId())) {
            throw new LedgerValidationException("MISSING_PAYER", "Payer is required");
        }
        if (!participants.contains(draft.getPayerId())) {
            throw new LedgerValidationException("PAYER_NOT_PARTICIPANT", "Payer must be a participant");
        }

        Set<String> involved = new LinkedHashSet<>(participants);
        involved.add(draft.getPayerId());
        List<String> unknown = new ArrayList<>();
        for (String memberId : involved) {
            if (!activeMembers.contains(memberId)) {
                unknown.add(memberId);
            }
        }
        if (!unknown.isEmpty()) {
            throw new LedgerValidationException("UNKNOWN_MEMBER", "Not active members of the group: " + unknown);
        }

        switch (draft.getSplitType()) {
            case EXACT -> validateExactSplits(draft);
            case PERCENTAGE -> validatePercentageSplits(draft);
            case EQUAL -> { }
        }
    }

    /**
     * Final guard on computed splits: they must cover the amount exactly.
     */
    public void validateSplitTotal(long amount, List<ExpenseSplit> splits) {
        long total = 0L;
        for (ExpenseSplit split : splits) {
            if (split.getAmount() < 0) {
                throw new LedgerValidationException("INVALID_SPLIT_AMOUNT",
                        "Split amount for " + split.getMemberId() + " is negative");
            }
            total = Math.addExact(total, split.getAmount());
        }
        if (total != amount) {
            throw new LedgerValidationException("INVALID_SPLIT_TOTAL",
                    "Split amounts sum to " + total + " but the expense amount is " + amount);
        }
    }

    private void validateDate(Instant date, Instant now) {
        if (date == null) {
            throw new LedgerValidationException("INVALID_DATE", "Date is required");
        }
        if (date.isAfter(now.plus(CLOCK_SKEW))) {
            throw new LedgerValidationException("INVALID_DATE", "Date cannot be in the future");
        }
        if (date.isBefore(now.minus(MAX_AGE_YEARS * 365, ChronoUnit.DAYS))) {
            throw new LedgerValidationException("INVALID_DATE",
                    "Date cannot be more than " + MAX_AGE_YEARS + " years in the past");
        }
    }

    private void validateSplitMembers(ExpenseDraft draft) {
        List<ExpenseDraft.SplitInput> inputs = draft.getSplitInputs();
        if (inputs == null || inputs.size() != draft.getParticipants().size()) {
            throw new LedgerValidationException("INVALID_SPLITS", "Splits must be provided for all participants");
        }
        Set<String> seen = new HashSet<>();
        Set<String> participants = new HashSet<>(draft.getParticipants());
        for (ExpenseDraft.SplitInput input : inputs) {
            if (!seen.add(input.getMemberId())) {
                throw new LedgerValidationException("DUPLICATE_SPLIT_USERS",
                        "Each participant can only appear once in splits");
            }
            if (!participants.contains(input.getMemberId())) {
                throw new LedgerValidationException("INVALID_SPLIT_USER", "Split user must be a participant");
            }
        }
    }

    private void validateExactSplits(ExpenseDraft draft) {
        validateSplitMembers(draft);
        long total = 0L;
        for (ExpenseDraft.SplitInput input : draft.getSplitInputs()) {
            if (input.getAmount() == null) {
                throw new LedgerValidationException("MISSING_SPLIT_AMOUNT", "Split amount is required for exact splits");
            }
            if (input.getAmount() < 0) {
                throw new LedgerValidationException("INVALID_SPLIT_AMOUNT",
                        "Split amount for " + input.getMemberId() + " is negative");
            }
            total = Math.addExact(total, input.getAmount());
        }
        if (total != draft.getAmount()) {
            throw new LedgerValidationException("INVALID_SPLIT_TOTAL", "Split amounts must equal total amount");
        }
    }

    private void validatePercentageSplits(ExpenseDraft draft) {
        validateSplitMembers(draft);
        long total = 0L;
        for (ExpenseDraft.SplitInput input : draft.getSplitInputs()) {
            Integer bp = input.getBasisPoints();
            if (bp == null) {
                throw new LedgerValidationException("MISSING_SPLIT_PERCENTAGE",
                        "Split percentage is required for percentage splits");
            }
            if (bp < 0 || bp > SplitCalculator.FULL_BASIS_POINTS) {
                throw new LedgerValidationException("INVALID_SPLIT_PERCENTAGE",
                        "Split percentage must be between 0 and 100");
            }
            total += bp;
        }
        if (total != SplitCalculator.FULL_BASIS_POINTS) {
            throw new LedgerValidationException("INVALID_PERCENTAGE_TOTAL", "Percentages must add up to 100");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
