package com.flagship.split_ledger.notification;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of change a client can react to. Each category has its own counter
 * column on the change-tracking record.
 */
public enum ChangeCategory {
    /** Expenses and settlements created, edited or deleted. */
    TRANSACTION,
    /** Derived balances may have moved. */
    BALANCE,
    /** Group name, description or membership changed. */
    GROUP_DETAILS,
    COMMENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
