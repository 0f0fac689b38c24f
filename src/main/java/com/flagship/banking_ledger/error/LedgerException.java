package com.flagship.banking_ledger.error;

/**
 * Base type for every failure the ledger engine reports.
 *
 * Business and validation failures are raised before or inside the atomic unit
 * and always leave ledger state unchanged.
 */
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorKind kind;

    protected LedgerException(LedgerErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(LedgerErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public LedgerErrorKind getKind() {
        return kind;
    }
}
