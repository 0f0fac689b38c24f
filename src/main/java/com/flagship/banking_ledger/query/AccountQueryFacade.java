package com.flagship.banking_ledger.query;

import com.flagship.banking_ledger.interest.InterestRecord;
import com.flagship.banking_ledger.ledger.Account;
import com.flagship.banking_ledger.ledger.Amounts;
import com.flagship.banking_ledger.ledger.LedgerStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only views over the ledger store. Never mutates and never caches.
 */
@Service
public class AccountQueryFacade {

    private final LedgerStore ledgerStore;
    private final int recentTransactionsLimit;

    public AccountQueryFacade(LedgerStore ledgerStore,
                              @Value("${ledger.recent-transactions.limit:10}") int recentTransactionsLimit) {
        this.ledgerStore = ledgerStore;
        this.recentTransactionsLimit = recentTransactionsLimit;
    }

    /**
     * @throws com.flagship.banking_ledger.error.AccountNotFoundException if the account does not exist
     */
    @Transactional(readOnly = true)
    public AccountInfo getAccountInfo(String accountId) {
        Account account = ledgerStore.getAccount(accountId);
        return new AccountInfo(
                account.getAccountId(),
                account.getCustomerName(),
                account.getBalance(),
                ledgerStore.getRecentTransactions(accountId, recentTransactionsLimit),
                Amounts.scaled(ledgerStore.sumAccruedInterest(accountId))
        );
    }

    /**
     * Newest calculation date first.
     *
     * @throws com.flagship.banking_ledger.error.AccountNotFoundException if the account does not exist
     */
    @Transactional(readOnly = true)
    public List<InterestRecord> getInterestHistory(String accountId) {
        ledgerStore.getAccount(accountId);
        return ledgerStore.getInterestHistory(accountId);
    }
}
