package com.flagship.banking_ledger.ledger;

import java.math.BigDecimal;

/**
 * Kind of ledger transaction. Amounts are stored positive; the sign is implied by the type.
 */
public enum TransactionType {
    DEPOSIT(1),
    WITHDRAWAL(-1),
    TRANSFER_IN(1),
    TRANSFER_OUT(-1);

    private final int sign;

    TransactionType(int sign) {
        this.sign = sign;
    }

    public boolean isCredit() {
        return sign > 0;
    }

    /**
     * Returns the balance delta this type applies for a positive amount.
     */
    public BigDecimal signed(BigDecimal amount) {
        return sign > 0 ? amount : amount.negate();
    }
}
