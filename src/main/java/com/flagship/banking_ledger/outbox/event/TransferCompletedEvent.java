package com.flagship.banking_ledger.outbox.event;

import com.flagship.banking_ledger.transfer.TransferResult;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once per transfer, after both legs committed together.
 */
@Value
public class TransferCompletedEvent implements LedgerEvent {
    UUID eventId;
    UUID transferId;
    String fromAccountId;
    String toAccountId;
    BigDecimal amount;
    BigDecimal fromBalanceAfter;
    BigDecimal toBalanceAfter;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferCompletedEvent from(TransferResult transfer) {
        return new TransferCompletedEvent(
            UUID.randomUUID(),
            transfer.getTransferId(),
            transfer.getFromAccountId(),
            transfer.getToAccountId(),
            transfer.getAmount(),
            transfer.getFromBalanceAfter(),
            transfer.getToBalanceAfter(),
            transfer.getTimestamp()
        );
    }
}
