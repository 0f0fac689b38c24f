package com.flagship.banking_ledger.error;

/**
 * Self-transfers, blank account ids and idempotency keys reused for a different request.
 */
public class InvalidTransferException extends LedgerException {

    public InvalidTransferException(String message) {
        super(LedgerErrorKind.INVALID_TRANSFER, message);
    }
}
