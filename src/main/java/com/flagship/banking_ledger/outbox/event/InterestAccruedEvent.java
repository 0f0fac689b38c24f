package com.flagship.banking_ledger.outbox.event;

import com.flagship.banking_ledger.interest.InterestRecord;
import com.flagship.banking_ledger.ledger.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class InterestAccruedEvent implements LedgerEvent {
    UUID eventId;
    String accountId;
    LocalDate calculationDate;
    BigDecimal interestRate;
    BigDecimal calculatedInterest;
    long transactionId;
    BigDecimal balanceAfter;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InterestAccrued";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InterestAccruedEvent from(InterestRecord record, Transaction deposit) {
        return new InterestAccruedEvent(
            UUID.randomUUID(),
            record.getAccountId(),
            record.getCalculationDate(),
            record.getInterestRate(),
            record.getCalculatedInterest(),
            deposit.getTransactionId(),
            deposit.getBalanceAfter(),
            deposit.getTimestamp()
        );
    }
}
