package com.flagship.split_ledger.common.exception;

/**
 * Transient infrastructure failure (connection refused, transaction timeout).
 * Callers may retry.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
