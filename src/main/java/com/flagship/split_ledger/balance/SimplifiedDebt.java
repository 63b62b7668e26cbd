package com.flagship.split_ledger.balance;

import lombok.Value;

/**
 * A suggested payment: {@code from} pays {@code to} the given amount.
 * Not a ledger entry until somebody records it as a settlement.
 */
@Value
public class SimplifiedDebt {
    String from;
    String to;
    long amount;
    String currency;
}
