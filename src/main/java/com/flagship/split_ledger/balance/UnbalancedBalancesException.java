package com.flagship.split_ledger.balance;

import lombok.Getter;

/**
 * Balances handed to the simplifier do not net to zero, which can only come
 * from a caller bug. The simplifier refuses rather than inventing or dropping
 * a payment.
 */
@Getter
public class UnbalancedBalancesException extends IllegalArgumentException {

    private final String currency;
    private final long residue;

    public UnbalancedBalancesException(String currency, long residue) {
        super(String.format("Balances for %s do not net to zero (residue=%d)", currency, residue));
        this.currency = currency;
        this.residue = residue;
    }
}
