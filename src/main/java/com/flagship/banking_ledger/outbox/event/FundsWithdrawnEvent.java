package com.flagship.banking_ledger.outbox.event;

import com.flagship.banking_ledger.ledger.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class FundsWithdrawnEvent implements LedgerEvent {
    UUID eventId;
    String accountId;
    long transactionId;
    BigDecimal amount;
    BigDecimal balanceAfter;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FundsWithdrawn";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static FundsWithdrawnEvent from(Transaction withdrawal) {
        return new FundsWithdrawnEvent(
            UUID.randomUUID(),
            withdrawal.getAccountId(),
            withdrawal.getTransactionId(),
            withdrawal.getAmount(),
            withdrawal.getBalanceAfter(),
            withdrawal.getTimestamp()
        );
    }
}
