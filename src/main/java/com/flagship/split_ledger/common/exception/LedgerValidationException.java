package com.flagship.split_ledger.common.exception;

import lombok.Getter;

/**
 * A mutation request broke a ledger rule (split sum, unknown member,
 * non-positive amount, ...). Raised before any write, so nothing is ever
 * partially applied. Never worth retrying.
 */
@Getter
public class LedgerValidationException extends RuntimeException {

    private final String code;

    public LedgerValidationException(String code, String message) {
        super(message);
        this.code = code;
    }
}
