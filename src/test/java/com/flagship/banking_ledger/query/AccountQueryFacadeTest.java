package com.flagship.banking_ledger.query;

import com.flagship.banking_ledger.error.AccountNotFoundException;
import com.flagship.banking_ledger.ledger.AccountService;
import com.flagship.banking_ledger.ledger.Transaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AccountQueryFacadeTest {

    @Autowired
    private AccountQueryFacade queryFacade;

    @Autowired
    private AccountService accountService;

    private String openAccount(String balance) {
        String accountId = "QRY-" + UUID.randomUUID().toString().substring(0, 8);
        accountService.openAccount(accountId, "Query Test", new BigDecimal(balance));
        return accountId;
    }

    @Test
    @DisplayName("Only the ten most recent transactions are returned, newest first")
    void lastTenNewestFirst() {
        String accountId = openAccount("0.00");
        for (int i = 1; i <= 12; i++) {
            accountService.deposit(accountId, new BigDecimal(i + ".00"));
        }

        AccountInfo info = queryFacade.getAccountInfo(accountId);

        assertEquals(0, new BigDecimal("78.00").compareTo(info.getBalance()));
        assertEquals("Query Test", info.getCustomerName());
        List<Transaction> recent = info.getRecentTransactions();
        assertEquals(10, recent.size());
        assertEquals(0, new BigDecimal("12.00").compareTo(recent.get(0).getAmount()));
        assertEquals(0, new BigDecimal("3.00").compareTo(recent.get(9).getAmount()));
        for (int i = 1; i < recent.size(); i++) {
            assertTrue(recent.get(i - 1).getTransactionId() > recent.get(i).getTransactionId());
            assertFalse(recent.get(i - 1).getTimestamp().isBefore(recent.get(i).getTimestamp()));
        }
    }

    @Test
    @DisplayName("Reading an account twice gives the same answer")
    void readsDoNotMutate() {
        String accountId = openAccount("42.00");
        accountService.deposit(accountId, new BigDecimal("1.00"));

        AccountInfo first = queryFacade.getAccountInfo(accountId);
        AccountInfo second = queryFacade.getAccountInfo(accountId);

        assertEquals(first, second);
        assertEquals(0, BigDecimal.ZERO.compareTo(first.getAccumulatedInterest()));
    }

    @Test
    @DisplayName("Unknown account is AccountNotFound for both reads")
    void unknownAccount() {
        String missing = "NOPE-" + UUID.randomUUID();

        assertThrows(AccountNotFoundException.class, () -> queryFacade.getAccountInfo(missing));
        assertThrows(AccountNotFoundException.class, () -> queryFacade.getInterestHistory(missing));
    }

    @Test
    @DisplayName("An account with no interest has an empty history")
    void emptyHistory() {
        assertTrue(queryFacade.getInterestHistory(openAccount("10.00")).isEmpty());
    }
}
