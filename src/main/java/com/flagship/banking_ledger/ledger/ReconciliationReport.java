package com.flagship.banking_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of checking {@code balance == initialBalance + signed sum of transactions} for one account.
 */
@Value
public class ReconciliationReport {
    String accountId;
    BigDecimal initialBalance;
    BigDecimal transactionTotal;
    BigDecimal expectedBalance;
    BigDecimal actualBalance;
    boolean balanced;
}
