package com.flagship.banking_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final LedgerStore ledgerStore;

    /**
     * Reads balance and transaction sum in one read-only transaction.
     *
     * @throws com.flagship.banking_ledger.error.AccountNotFoundException if the account does not exist
     */
    @Transactional(readOnly = true)
    public ReconciliationReport reconcile(String accountId) {
        Account account = ledgerStore.getAccount(accountId);
        BigDecimal transactionTotal = Amounts.scaled(ledgerStore.sumSignedTransactions(accountId));
        BigDecimal expected = account.getInitialBalance().add(transactionTotal);
        boolean balanced = expected.compareTo(account.getBalance()) == 0;

        if (!balanced) {
            log.error("Reconciliation mismatch for account {}: expected={}, actual={}",
                    accountId, expected, account.getBalance());
        }

        return new ReconciliationReport(
                accountId,
                account.getInitialBalance(),
                transactionTotal,
                expected,
                account.getBalance(),
                balanced
        );
    }
}
