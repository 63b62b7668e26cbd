package com.flagship.split_ledger.support;

import com.flagship.split_ledger.expense.Expense;
import com.flagship.split_ledger.expense.ExpenseSplit;
import com.flagship.split_ledger.expense.SplitType;
import com.flagship.split_ledger.settlement.Settlement;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Builders for ledger records used across unit tests.
 */
public final class LedgerFixtures {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private LedgerFixtures() {
    }

    public static Expense expense(String groupId, String payerId, long amount, String currency,
                                  ExpenseSplit... splits) {
        return Expense.builder()
                .id(UUID.randomUUID())
                .groupId(groupId)
                .description("Dinner")
                .category("food")
                .date(NOW)
                .payerId(payerId)
                .amount(amount)
                .currency(currency)
                .splitType(SplitType.EXACT)
                .splits(List.copyOf(Arrays.asList(splits)))
                .createdBy(payerId)
                .version(1)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static ExpenseSplit split(String memberId, long amount) {
        return ExpenseSplit.of(memberId, amount);
    }

    public static Settlement settlement(String groupId, String payerId, String payeeId, long amount, String currency) {
        return Settlement.builder()
                .id(UUID.randomUUID())
                .groupId(groupId)
                .payerId(payerId)
                .payeeId(payeeId)
                .amount(amount)
                .currency(currency)
                .date(NOW)
                .createdBy(payerId)
                .version(1)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
