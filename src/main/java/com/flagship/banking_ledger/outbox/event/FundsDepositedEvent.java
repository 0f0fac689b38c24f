package com.flagship.banking_ledger.outbox.event;

import com.flagship.banking_ledger.ledger.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class FundsDepositedEvent implements LedgerEvent {
    UUID eventId;
    String accountId;
    long transactionId;
    BigDecimal amount;
    BigDecimal balanceAfter;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FundsDeposited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static FundsDepositedEvent from(Transaction deposit) {
        return new FundsDepositedEvent(
            UUID.randomUUID(),
            deposit.getAccountId(),
            deposit.getTransactionId(),
            deposit.getAmount(),
            deposit.getBalanceAfter(),
            deposit.getTimestamp()
        );
    }
}
