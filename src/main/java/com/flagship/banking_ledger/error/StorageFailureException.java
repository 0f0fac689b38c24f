package com.flagship.banking_ledger.error;

public class StorageFailureException extends LedgerException {

    public StorageFailureException(String message, Throwable cause) {
        super(LedgerErrorKind.STORAGE_FAILURE, message, cause);
    }
}
