package com.flagship.banking_ledger.error;

import java.math.BigDecimal;

public class InvalidAmountException extends LedgerException {

    private final BigDecimal amount;

    public InvalidAmountException(BigDecimal amount, String reason) {
        super(LedgerErrorKind.INVALID_AMOUNT, reason);
        this.amount = amount;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
