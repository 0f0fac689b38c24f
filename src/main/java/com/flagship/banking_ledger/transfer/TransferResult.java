package com.flagship.banking_ledger.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Confirmation of a committed transfer. Rebuildable at any time from its two linked transactions.
 */
@Value
public class TransferResult {
    UUID transferId;
    String fromAccountId;
    String toAccountId;
    BigDecimal amount;
    BigDecimal fromBalanceAfter;
    BigDecimal toBalanceAfter;
    Instant timestamp;
}
