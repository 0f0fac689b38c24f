package com.flagship.banking_ledger.outbox.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A committed fact about the ledger, published through the outbox.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    Instant getOccurredAt();

    String getEventType();
}
