package com.flagship.banking_ledger.ledger;

/**
 * The idempotency key was already claimed by a committed unit of work.
 * The unit that raised it is rolled back; callers replay the original result.
 */
public class DuplicateIdempotencyKeyException extends RuntimeException {

    private final String idempotencyKey;

    public DuplicateIdempotencyKeyException(String idempotencyKey, Throwable cause) {
        super("Idempotency key already used: " + idempotencyKey, cause);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
