package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.error.AccountNotFoundException;
import com.flagship.banking_ledger.interest.InterestRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Durable storage of accounts, the append-only transaction log and interest history.
 *
 * All mutations go through {@link #inAtomicUnit(Function)}. Storage faults surface as
 * {@link com.flagship.banking_ledger.error.StorageTimeoutException} or
 * {@link com.flagship.banking_ledger.error.StorageFailureException} and leave state unchanged.
 */
public interface LedgerStore {

    /**
     * Runs {@code work} as one atomic unit: commit on return, full rollback on any exception.
     * Joins the caller's transaction if one is already active.
     */
    <T> T inAtomicUnit(Function<LedgerUnit, T> work);

    Optional<Account> findAccount(String accountId);

    default Account getAccount(String accountId) {
        return findAccount(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    List<String> findAllAccountIds();

    /**
     * Most recent first: timestamp descending, ties broken by transaction id descending.
     */
    List<Transaction> getRecentTransactions(String accountId, int limit);

    List<Transaction> findTransactionsByTransferId(UUID transferId);

    /**
     * Newest calculation date first.
     */
    List<InterestRecord> getInterestHistory(String accountId);

    BigDecimal sumAccruedInterest(String accountId);

    /**
     * Signed sum of every transaction on the account (credits positive, debits negative).
     */
    BigDecimal sumSignedTransactions(String accountId);

    Optional<UUID> findTransferIdByIdempotencyKey(String idempotencyKey);

    /**
     * Inserts an account with its opening balance. Used for seeding; not part of the ledger API.
     */
    Account createAccount(String accountId, String customerName, BigDecimal initialBalance);
}
