package com.flagship.banking_ledger.error;

import java.util.UUID;

public class TransferNotFoundException extends LedgerException {

    public TransferNotFoundException(UUID transferId) {
        super(LedgerErrorKind.TRANSFER_NOT_FOUND, "Transfer not found: " + transferId);
    }
}
