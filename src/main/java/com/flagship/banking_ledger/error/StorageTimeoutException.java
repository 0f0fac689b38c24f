package com.flagship.banking_ledger.error;

public class StorageTimeoutException extends LedgerException {

    public StorageTimeoutException(String message, Throwable cause) {
        super(LedgerErrorKind.STORAGE_TIMEOUT, message, cause);
    }
}
