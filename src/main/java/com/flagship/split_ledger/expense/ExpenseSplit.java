package com.flagship.split_ledger.expense;

import lombok.Value;

/**
 * One participant's share of an expense, in minor units.
 *
 * {@code percentageBasisPoints} is only set for percentage splits
 * (10000 basis points = 100%).
 */
@Value
public class ExpenseSplit {
    String memberId;
    long amount;
    Integer percentageBasisPoints;

    public static ExpenseSplit of(String memberId, long amount) {
        return new ExpenseSplit(memberId, amount, null);
    }
}
