package com.flagship.banking_ledger.error;

/**
 * A mutation would have broken a ledger constraint (negative balance, or a
 * database integrity rule). The atomic unit is rolled back.
 */
public class BalanceConstraintViolationException extends LedgerException {

    public BalanceConstraintViolationException(String message) {
        super(LedgerErrorKind.CONSTRAINT_VIOLATION, message);
    }

    public BalanceConstraintViolationException(String message, Throwable cause) {
        super(LedgerErrorKind.CONSTRAINT_VIOLATION, message, cause);
    }
}
