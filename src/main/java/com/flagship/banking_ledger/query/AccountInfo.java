package com.flagship.banking_ledger.query;

import com.flagship.banking_ledger.ledger.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Account snapshot: balance, most recent transactions (newest first) and interest accrued to date.
 */
@Value
public class AccountInfo {
    String accountId;
    String customerName;
    BigDecimal balance;
    List<Transaction> recentTransactions;
    BigDecimal accumulatedInterest;
}
