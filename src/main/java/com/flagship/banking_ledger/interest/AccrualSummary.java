package com.flagship.banking_ledger.interest;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Totals of one accrual run. Every account lands in exactly one of the four counts.
 */
@Value
public class AccrualSummary {
    LocalDate calculationDate;
    BigDecimal interestRate;
    int accountsCredited;
    int alreadyAccrued;
    int zeroInterest;
    int failed;
    BigDecimal totalInterest;
}
