package com.flagship.split_ledger.expense;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an expense total is divided among its participants.
 */
public enum SplitType {
    EQUAL,
    EXACT,
    PERCENTAGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SplitType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        try {
            return SplitType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Split type must be equal, exact, or percentage");
        }
    }
}
