package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.error.InsufficientFundsException;

import java.math.BigDecimal;

/**
 * Balance-delta function evaluated against the locked, current state of an account.
 * Implementations may throw a {@link com.flagship.banking_ledger.error.LedgerException}
 * to abort the atomic unit.
 */
@FunctionalInterface
public interface BalanceMutation {

    BigDecimal delta(Account lockedAccount);

    static BalanceMutation credit(BigDecimal amount) {
        return account -> amount;
    }

    /**
     * Debit that fails with InsufficientFunds when the locked balance does not cover it.
     */
    static BalanceMutation debit(BigDecimal amount) {
        return account -> {
            if (account.getBalance().compareTo(amount) < 0) {
                throw new InsufficientFundsException(
                    account.getAccountId(), amount, account.getBalance());
            }
            return amount.negate();
        };
    }
}
