package com.flagship.banking_ledger.interest;

import com.flagship.banking_ledger.ledger.Transaction;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of crediting one account's daily interest.
 * {@code record} and {@code deposit} are only set when {@code status} is CREDITED.
 */
@Value
public class InterestCredit {

    public enum Status {
        CREDITED,
        ALREADY_ACCRUED,
        ZERO_INTEREST
    }

    String accountId;
    Status status;
    InterestRecord record;
    Transaction deposit;

    public static InterestCredit credited(InterestRecord record, Transaction deposit) {
        return new InterestCredit(record.getAccountId(), Status.CREDITED, record, deposit);
    }

    public static InterestCredit alreadyAccrued(String accountId) {
        return new InterestCredit(accountId, Status.ALREADY_ACCRUED, null, null);
    }

    public static InterestCredit zeroInterest(String accountId) {
        return new InterestCredit(accountId, Status.ZERO_INTEREST, null, null);
    }

    public BigDecimal getCreditedAmount() {
        return record != null ? record.getCalculatedInterest() : BigDecimal.ZERO;
    }
}
