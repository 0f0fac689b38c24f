package com.flagship.banking_ledger.interest;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One day's interest credited to an account.
 * Each record corresponds 1:1 with the DEPOSIT transaction identified by {@code transactionId}.
 */
@Value
public class InterestRecord {
    long id;
    String accountId;
    BigDecimal interestRate;
    BigDecimal calculatedInterest;
    LocalDate calculationDate;
    long transactionId;
}
