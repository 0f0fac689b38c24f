package com.flagship.banking_ledger.error;

import java.math.BigDecimal;

/**
 * Raised under the account row lock, so the balance it reports is the committed one.
 */
public class InsufficientFundsException extends LedgerException {

    private final String accountId;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientFundsException(String accountId, BigDecimal requested, BigDecimal available) {
        super(LedgerErrorKind.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds in account %s: requested=%s, available=%s",
                accountId, requested, available));
        this.accountId = accountId;
        this.requested = requested;
        this.available = available;
    }

    public String getAccountId() {
        return accountId;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
