package com.flagship.banking_ledger.transfer;

import com.flagship.banking_ledger.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps transfer idempotency keys to the transfer they created.
 *
 * The transfer_idempotency_keys table is the source of truth; the key is claimed inside the
 * transfer's own atomic unit. Redis is a fast path in front of it: a Redis miss or outage
 * falls through to the database and never fails a transfer.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:transfer-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerStore ledgerStore;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(LedgerStore ledgerStore, Optional<StringRedisTemplate> redisTemplate) {
        this.ledgerStore = ledgerStore;
        this.redisTemplate = redisTemplate;
    }

    public Optional<UUID> findTransferId(String idempotencyKey) {
        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = ledgerStore.findTransferIdByIdempotencyKey(idempotencyKey);
        stored.ifPresent(transferId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            remember(idempotencyKey, transferId);
        });
        return stored;
    }

    /**
     * Caches a committed key in Redis. Best effort.
     */
    public void remember(String idempotencyKey, UUID transferId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transferId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }
}
