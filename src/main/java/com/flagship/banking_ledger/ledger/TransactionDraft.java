package com.flagship.banking_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Transaction record to append as part of a read-modify-append mutation.
 * The store assigns the id and the resulting balance.
 *
 * A draft without a timestamp is stamped by the unit once the account rows it touches are locked,
 * so row timestamps follow the order in which mutations take effect.
 */
@Value
public class TransactionDraft {
    TransactionType type;
    BigDecimal amount;
    String description;
    UUID transferId;
    Instant timestamp;

    private TransactionDraft(TransactionType type, BigDecimal amount, String description,
                             UUID transferId, Instant timestamp) {
        this.type = Objects.requireNonNull(type);
        this.amount = Objects.requireNonNull(amount);
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Transaction amount must be positive");
        }
        this.description = description;
        this.transferId = transferId;
        this.timestamp = timestamp;
    }

    public static TransactionDraft of(TransactionType type, BigDecimal amount, String description) {
        return new TransactionDraft(type, amount, description, null, null);
    }

    /**
     * Draft with a fixed timestamp, for imported or backdated rows.
     */
    public static TransactionDraft of(TransactionType type, BigDecimal amount, String description, Instant timestamp) {
        return new TransactionDraft(type, amount, description, null, Objects.requireNonNull(timestamp));
    }

    public static TransactionDraft transferLeg(TransactionType type, BigDecimal amount, String description,
                                               UUID transferId) {
        return new TransactionDraft(type, amount, description, Objects.requireNonNull(transferId), null);
    }

    public boolean isStamped() {
        return timestamp != null;
    }

    Instant timestampOr(Instant lockTime) {
        return timestamp != null ? timestamp : lockTime;
    }
}
