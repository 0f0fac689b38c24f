package com.flagship.banking_ledger.error;

import org.springframework.http.HttpStatus;

/**
 * Stable error identifiers returned to clients alongside a human-readable reason.
 * The HTTP status is the default mapping used by the REST layer.
 */
public enum LedgerErrorKind {

    INVALID_AMOUNT(HttpStatus.BAD_REQUEST),
    INVALID_TRANSFER(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_FUNDS(HttpStatus.BAD_REQUEST),
    CONSTRAINT_VIOLATION(HttpStatus.BAD_REQUEST),
    ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND),
    TRANSFER_NOT_FOUND(HttpStatus.NOT_FOUND),
    STORAGE_TIMEOUT(HttpStatus.INTERNAL_SERVER_ERROR),
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    LedgerErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    /**
     * Storage faults never expose their internal message to callers.
     */
    public boolean isInternal() {
        return this == STORAGE_TIMEOUT || this == STORAGE_FAILURE;
    }
}
