package com.flagship.split_ledger.common.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Optimistic version check failed and the bounded retries (if any) were exhausted.
 * The caller should re-read the record and decide again.
 */
@Getter
public class ConflictException extends RuntimeException {

    private final UUID recordId;
    private final int attempts;

    public ConflictException(UUID recordId, int attempts) {
        super(String.format("Record %s was modified concurrently (attempts=%d). Refresh and try again.",
                recordId, attempts));
        this.recordId = recordId;
        this.attempts = attempts;
    }
}
