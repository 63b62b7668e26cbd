package com.flagship.split_ledger.common.exception;

import lombok.Getter;

/**
 * The acting user is a group member but not allowed to perform this change
 * (for example editing someone else's settlement).
 */
@Getter
public class ForbiddenOperationException extends RuntimeException {

    private final String code;

    public ForbiddenOperationException(String code, String message) {
        super(message);
        this.code = code;
    }
}
