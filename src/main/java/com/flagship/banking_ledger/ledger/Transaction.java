package com.flagship.banking_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for a committed ledger transaction.
 * Immutable once written: corrections are new offsetting transactions.
 *
 * {@code transferId} is set only on TRANSFER_IN / TRANSFER_OUT rows and is shared by both legs.
 */
@Value
public class Transaction {
    long transactionId;
    String accountId;
    TransactionType type;
    BigDecimal amount;
    BigDecimal balanceAfter;
    Instant timestamp;
    String description;
    UUID transferId;

    public BigDecimal getSignedAmount() {
        return type.signed(amount);
    }
}
