package com.flagship.banking_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Domain model for a customer account.
 * Owned by the ledger store; balances only change through a {@link LedgerUnit}.
 *
 * Invariant: balance >= 0 at every externally observable instant.
 */
@Value
public class Account {
    String accountId;
    String customerName;
    BigDecimal balance;
    BigDecimal initialBalance;
    Instant createdAt;
}
