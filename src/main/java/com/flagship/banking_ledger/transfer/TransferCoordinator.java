package com.flagship.banking_ledger.transfer;

import com.flagship.banking_ledger.error.InvalidTransferException;
import com.flagship.banking_ledger.error.LedgerException;
import com.flagship.banking_ledger.error.TransferNotFoundException;
import com.flagship.banking_ledger.ledger.Amounts;
import com.flagship.banking_ledger.ledger.BalanceMutation;
import com.flagship.banking_ledger.ledger.DuplicateIdempotencyKeyException;
import com.flagship.banking_ledger.ledger.LedgerStore;
import com.flagship.banking_ledger.ledger.LedgerUnit;
import com.flagship.banking_ledger.ledger.Leg;
import com.flagship.banking_ledger.ledger.Transaction;
import com.flagship.banking_ledger.ledger.TransactionDraft;
import com.flagship.banking_ledger.ledger.TransactionType;
import com.flagship.banking_ledger.observability.CorrelationContext;
import com.flagship.banking_ledger.observability.LedgerMetrics;
import com.flagship.banking_ledger.outbox.OutboxService;
import com.flagship.banking_ledger.outbox.event.TransferCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Moves money between two accounts as one atomic unit.
 *
 * Protocol:
 * 1. Amount and account pair are validated before storage is touched.
 * 2. Both account rows are locked in lexicographic order of account id, whatever the direction
 *    of the transfer. Two transfers over the same pair therefore always queue on the same first
 *    lock and cannot deadlock.
 * 3. With both rows locked, the source balance is checked, the TRANSFER_OUT and TRANSFER_IN rows
 *    are appended with a shared transfer id and one timestamp taken after both locks, and a
 *    TransferCompleted event is written to the outbox.
 * 4. Commit makes both legs visible at once; any failure rolls back both.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferCoordinator {

    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    private final LedgerStore ledgerStore;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    public TransferResult transfer(String fromAccountId, String toAccountId, BigDecimal amount) {
        return transfer(fromAccountId, toAccountId, amount, null);
    }

    /**
     * @param idempotencyKey optional; a repeated key returns the original confirmation without
     *                       moving money again, provided the request matches the original
     */
    public TransferResult transfer(String fromAccountId, String toAccountId, BigDecimal amount,
                                   String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        try {
            BigDecimal validAmount = Amounts.requirePositive(amount);
            validatePair(fromAccountId, toAccountId);
            String key = normalizeKey(idempotencyKey);

            if (key != null) {
                Optional<UUID> existing = idempotencyService.findTransferId(key);
                if (existing.isPresent()) {
                    metrics.recordIdempotencyHit();
                    return replay(existing.get(), key, fromAccountId, toAccountId, validAmount);
                }
                metrics.recordIdempotencyMiss();
            }

            UUID transferId = UUID.randomUUID();
            MDC.put(CorrelationContext.TRANSFER_ID_MDC_KEY, transferId.toString());

            TransferResult result;
            try {
                result = ledgerStore.inAtomicUnit(unit ->
                        execute(unit, transferId, fromAccountId, toAccountId, validAmount, key));
            } catch (DuplicateIdempotencyKeyException e) {
                // lost the race for the key to a concurrent identical request
                UUID winner = ledgerStore.findTransferIdByIdempotencyKey(key)
                        .orElseThrow(() -> new IllegalStateException("Claimed idempotency key vanished: " + key, e));
                metrics.recordIdempotencyHit();
                return replay(winner, key, fromAccountId, toAccountId, validAmount);
            }

            if (key != null) {
                idempotencyService.remember(key, transferId);
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation("transfer", LedgerMetrics.OUTCOME_SUCCESS);
            log.info("Transfer committed: from={}, to={}, amount={}, duration={}ms",
                    fromAccountId, toAccountId, validAmount, duration);
            return result;

        } catch (LedgerException e) {
            metrics.recordOperation("transfer", e.getKind().name());
            if (e.getKind().isInternal()) {
                log.error("Transfer failed: from={}, to={}, kind={}", fromAccountId, toAccountId, e.getKind(), e);
            } else {
                log.warn("Transfer rejected: from={}, to={}, kind={}, reason={}",
                        fromAccountId, toAccountId, e.getKind(), e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation("transfer", LedgerMetrics.OUTCOME_ERROR);
            log.error("Transfer failed: from={}, to={}", fromAccountId, toAccountId, e);
            throw e;
        } finally {
            metrics.recordLatency("transfer", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TRANSFER_ID_MDC_KEY);
        }
    }

    /**
     * Rebuilds a transfer confirmation from its two linked rows.
     *
     * @throws TransferNotFoundException if no committed transfer has this id
     */
    public TransferResult findTransfer(UUID transferId) {
        List<Transaction> legs = ledgerStore.findTransactionsByTransferId(transferId);
        Transaction out = findLeg(legs, TransactionType.TRANSFER_OUT)
                .orElseThrow(() -> new TransferNotFoundException(transferId));
        Transaction in = findLeg(legs, TransactionType.TRANSFER_IN)
                .orElseThrow(() -> new TransferNotFoundException(transferId));
        return toResult(transferId, out, in);
    }

    private TransferResult execute(LedgerUnit unit, UUID transferId, String fromAccountId, String toAccountId,
                                   BigDecimal amount, String idempotencyKey) {
        if (idempotencyKey != null) {
            unit.claimIdempotencyKey(idempotencyKey, transferId);
        }

        Leg debit = new Leg(fromAccountId, BalanceMutation.debit(amount),
                TransactionDraft.transferLeg(TransactionType.TRANSFER_OUT, amount,
                        "Transfer to " + toAccountId + " [" + transferId + "]", transferId));
        Leg credit = new Leg(toAccountId, BalanceMutation.credit(amount),
                TransactionDraft.transferLeg(TransactionType.TRANSFER_IN, amount,
                        "Transfer from " + fromAccountId + " [" + transferId + "]", transferId));

        boolean debitLocksFirst = fromAccountId.compareTo(toAccountId) < 0;
        List<Transaction> posted = debitLocksFirst
                ? unit.applyPair(debit, credit)
                : unit.applyPair(credit, debit);
        Transaction out = debitLocksFirst ? posted.get(0) : posted.get(1);
        Transaction in = debitLocksFirst ? posted.get(1) : posted.get(0);

        TransferResult result = toResult(transferId, out, in);
        outboxService.saveEvent(OutboxService.TRANSFER_AGGREGATE, transferId.toString(),
                TransferCompletedEvent.from(result));
        return result;
    }

    private TransferResult replay(UUID transferId, String key, String fromAccountId, String toAccountId,
                                  BigDecimal amount) {
        TransferResult original = findTransfer(transferId);
        if (!original.getFromAccountId().equals(fromAccountId)
                || !original.getToAccountId().equals(toAccountId)
                || original.getAmount().compareTo(amount) != 0) {
            throw new InvalidTransferException("Idempotency key " + key + " was already used for a different transfer");
        }
        log.info("Idempotent replay of transfer {}", transferId);
        return original;
    }

    private static void validatePair(String fromAccountId, String toAccountId) {
        if (fromAccountId == null || fromAccountId.isBlank() || toAccountId == null || toAccountId.isBlank()) {
            throw new InvalidTransferException("Source and destination accounts are required");
        }
        if (fromAccountId.equals(toAccountId)) {
            throw new InvalidTransferException("Cannot transfer to the same account: " + fromAccountId);
        }
    }

    private static String normalizeKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return null;
        }
        if (idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new InvalidTransferException(
                    "Idempotency key longer than " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        return idempotencyKey;
    }

    private static Optional<Transaction> findLeg(List<Transaction> legs, TransactionType type) {
        return legs.stream().filter(t -> t.getType() == type).findFirst();
    }

    private static TransferResult toResult(UUID transferId, Transaction out, Transaction in) {
        return new TransferResult(
                transferId,
                out.getAccountId(),
                in.getAccountId(),
                out.getAmount(),
                out.getBalanceAfter(),
                in.getBalanceAfter(),
                out.getTimestamp()
        );
    }
}
