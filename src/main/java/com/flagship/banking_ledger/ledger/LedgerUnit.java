package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.interest.InterestRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Operations available inside one atomic unit of the ledger store.
 *
 * Everything done through a unit commits together when the unit's work returns,
 * or is rolled back together when it throws. Account rows locked through the unit
 * stay locked until then.
 */
public interface LedgerUnit {

    /**
     * Locks the account row for the rest of the unit and returns its current state.
     *
     * @throws com.flagship.banking_ledger.error.AccountNotFoundException if the id does not resolve
     */
    Account lockAccount(String accountId);

    /**
     * Applies the mutation to an account already locked by this unit and appends the draft.
     * An unstamped draft is stamped now, with the row already locked.
     *
     * @return the appended transaction, carrying the resulting balance
     * @throws com.flagship.banking_ledger.error.BalanceConstraintViolationException if the
     *         resulting balance would be negative
     */
    Transaction post(Account lockedAccount, BalanceMutation mutation, TransactionDraft draft);

    /**
     * Read-modify-append on a single account: lock, evaluate the delta, write balance and row.
     */
    Transaction apply(String accountId, BalanceMutation mutation, TransactionDraft draft);

    /**
     * Two-account variant. Locks {@code first} then {@code second}, in exactly that order,
     * before applying either mutation. Callers are responsible for passing the legs in a
     * direction-independent order. Unstamped legs share one timestamp taken after both locks.
     *
     * @return the appended transactions, in the order of the legs
     */
    List<Transaction> applyPair(Leg first, Leg second);

    boolean hasInterestFor(String accountId, LocalDate calculationDate);

    InterestRecord recordInterest(String accountId, BigDecimal interestRate, BigDecimal calculatedInterest,
                                  LocalDate calculationDate, long transactionId);

    /**
     * Reserves an idempotency key for a transfer within this unit.
     *
     * @throws DuplicateIdempotencyKeyException if the key is already taken
     */
    void claimIdempotencyKey(String idempotencyKey, UUID transferId);
}
