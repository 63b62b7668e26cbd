package com.flagship.split_ledger.common.exception;

public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String recordType, Object id) {
        super(recordType + " not found: " + id);
    }
}
