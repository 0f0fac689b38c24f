package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.error.AccountNotFoundException;
import com.flagship.banking_ledger.error.InsufficientFundsException;
import com.flagship.banking_ledger.error.InvalidAmountException;
import com.flagship.banking_ledger.error.LedgerErrorKind;
import com.flagship.banking_ledger.outbox.OutboxEvent;
import com.flagship.banking_ledger.outbox.OutboxService;
import com.flagship.banking_ledger.outbox.event.FundsDepositedEvent;
import com.flagship.banking_ledger.outbox.event.FundsWithdrawnEvent;
import com.flagship.banking_ledger.query.AccountInfo;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deposit and withdrawal behaviour through the service layer, with the real store and outbox.
 */
@SpringBootTest
class AccountServiceTest {

    @Autowired
    private AccountService accountService;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private MeterRegistry meterRegistry;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSection(String section) {
        System.out.println("\n--- " + section + " ---");
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printInvariant(String invariant) {
        System.out.println("🔒 INVARIANT: " + invariant);
    }

    private String openAccount(String balance) {
        String accountId = "SVC-" + UUID.randomUUID().toString().substring(0, 8);
        accountService.openAccount(accountId, "Service Test", new BigDecimal(balance));
        return accountId;
    }

    @Nested
    @DisplayName("1. Deposits")
    class Deposits {

        @Test
        @DisplayName("1.1 Deposit raises the balance and appends a DEPOSIT row")
        void depositRaisesBalance() {
            printTestHeader("Deposit Raises Balance");

            // GIVEN: an account with 1000.00
            String accountId = openAccount("1000.00");

            // WHEN: 500.00 is deposited
            BigDecimal balance = accountService.deposit(accountId, new BigDecimal("500.00"));

            // THEN
            assertEquals(0, new BigDecimal("1500.00").compareTo(balance));
            AccountInfo info = accountService.getAccountInfo(accountId);
            assertEquals(0, new BigDecimal("1500.00").compareTo(info.getBalance()));
            assertEquals(1, info.getRecentTransactions().size());

            Transaction row = info.getRecentTransactions().get(0);
            assertEquals(TransactionType.DEPOSIT, row.getType());
            assertEquals(0, new BigDecimal("500.00").compareTo(row.getAmount()));
            assertEquals(0, new BigDecimal("1500.00").compareTo(row.getBalanceAfter()));
            assertNull(row.getTransferId());

            printSuccess("Balance 1000.00 -> 1500.00");
        }

        @Test
        @DisplayName("1.2 Zero, negative, null and sub-cent amounts are InvalidAmount")
        void invalidAmounts() {
            printTestHeader("Invalid Deposit Amounts");

            String accountId = openAccount("100.00");

            for (String bad : List.of("0", "0.00", "-5.00", "1.001")) {
                InvalidAmountException e = assertThrows(InvalidAmountException.class,
                        () -> accountService.deposit(accountId, new BigDecimal(bad)));
                assertEquals(LedgerErrorKind.INVALID_AMOUNT, e.getKind());
            }
            assertThrows(InvalidAmountException.class, () -> accountService.deposit(accountId, null));

            AccountInfo info = accountService.getAccountInfo(accountId);
            assertEquals(0, new BigDecimal("100.00").compareTo(info.getBalance()));
            assertTrue(info.getRecentTransactions().isEmpty());

            printInvariant("Rejected operations write nothing");
        }

        @Test
        @DisplayName("1.3 Deposit to an unknown or blank account is AccountNotFound")
        void unknownAccount() {
            printTestHeader("Deposit To Unknown Account");

            assertThrows(AccountNotFoundException.class,
                    () -> accountService.deposit("NOPE-" + UUID.randomUUID(), new BigDecimal("10.00")));
            assertThrows(AccountNotFoundException.class,
                    () -> accountService.deposit("  ", new BigDecimal("10.00")));

            printSuccess("AccountNotFound raised");
        }

        @Test
        @DisplayName("1.4 Validation runs before the account lookup")
        void amountCheckedFirst() {
            assertThrows(InvalidAmountException.class,
                    () -> accountService.deposit("NOPE-" + UUID.randomUUID(), new BigDecimal("-1")));
        }
    }

    @Nested
    @DisplayName("2. Withdrawals")
    class Withdrawals {

        @Test
        @DisplayName("2.1 Withdrawal lowers the balance and appends a WITHDRAWAL row")
        void withdrawalLowersBalance() {
            printTestHeader("Withdrawal Lowers Balance");

            String accountId = openAccount("1500.00");

            BigDecimal balance = accountService.withdraw(accountId, new BigDecimal("200.00"));

            assertEquals(0, new BigDecimal("1300.00").compareTo(balance));
            Transaction row = accountService.getAccountInfo(accountId).getRecentTransactions().get(0);
            assertEquals(TransactionType.WITHDRAWAL, row.getType());
            assertEquals(0, new BigDecimal("-200.00").compareTo(row.getSignedAmount()));

            printSuccess("Balance 1500.00 -> 1300.00");
        }

        @Test
        @DisplayName("2.2 Overdraw is InsufficientFunds and leaves no trace")
        void overdrawRejected() {
            printTestHeader("Overdraw Rejected");

            // GIVEN: an account with 50.00
            String accountId = openAccount("50.00");

            // WHEN / THEN: withdrawing 100.00 fails
            InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                    () -> accountService.withdraw(accountId, new BigDecimal("100.00")));
            assertEquals(LedgerErrorKind.INSUFFICIENT_FUNDS, e.getKind());

            AccountInfo info = accountService.getAccountInfo(accountId);
            assertEquals(0, new BigDecimal("50.00").compareTo(info.getBalance()));
            assertTrue(info.getRecentTransactions().isEmpty());

            printInvariant("Balance never goes negative");
        }

        @Test
        @DisplayName("2.3 Withdrawing the exact balance leaves zero")
        void exactBalance() {
            String accountId = openAccount("75.25");

            BigDecimal balance = accountService.withdraw(accountId, new BigDecimal("75.25"));

            assertEquals(0, BigDecimal.ZERO.compareTo(balance));
        }
    }

    @Nested
    @DisplayName("3. Side effects")
    class SideEffects {

        @Test
        @DisplayName("3.1 Each committed mutation writes one outbox event for the account")
        void outboxEventsWritten() {
            printTestHeader("Outbox Events Written");

            String accountId = openAccount("100.00");
            accountService.deposit(accountId, new BigDecimal("10.00"));
            accountService.withdraw(accountId, new BigDecimal("5.00"));
            assertThrows(InsufficientFundsException.class,
                    () -> accountService.withdraw(accountId, new BigDecimal("500.00")));

            List<OutboxEvent> events = outboxService.getEventsForAggregate(OutboxService.ACCOUNT_AGGREGATE, accountId);

            printSection("Events");
            events.forEach(event -> System.out.println(event.getEventType() + " " + event.getPayload()));

            assertEquals(2, events.size());
            assertEquals(FundsDepositedEvent.EVENT_TYPE, events.get(0).getEventType());
            assertEquals(FundsWithdrawnEvent.EVENT_TYPE, events.get(1).getEventType());
            assertTrue(events.get(0).getPayload().contains(accountId));
            assertFalse(events.get(0).isPublished());

            printInvariant("Rejected withdrawal produced no event");
        }

        @Test
        @DisplayName("3.2 Outcomes are counted per operation and kind")
        void metricsRecorded() {
            String accountId = openAccount("10.00");
            double successBefore = count("deposit", "success");
            double rejectedBefore = count("withdrawal", "INSUFFICIENT_FUNDS");

            accountService.deposit(accountId, new BigDecimal("1.00"));
            assertThrows(InsufficientFundsException.class,
                    () -> accountService.withdraw(accountId, new BigDecimal("100.00")));

            assertEquals(successBefore + 1, count("deposit", "success"));
            assertEquals(rejectedBefore + 1, count("withdrawal", "INSUFFICIENT_FUNDS"));
        }

        private double count(String operation, String outcome) {
            var counter = meterRegistry.find("ledger.operations")
                    .tag("operation", operation)
                    .tag("outcome", outcome)
                    .counter();
            return counter != null ? counter.count() : 0.0;
        }
    }

    @Nested
    @DisplayName("4. Reconciliation")
    class Reconciliation {

        @Test
        @DisplayName("4.1 Balance equals initial balance plus signed transaction sum")
        void balancedAfterMutations() {
            printTestHeader("Reconciliation Balanced");

            String accountId = openAccount("1000.00");
            accountService.deposit(accountId, new BigDecimal("500.00"));
            accountService.withdraw(accountId, new BigDecimal("200.00"));
            accountService.deposit(accountId, new BigDecimal("0.01"));

            ReconciliationReport report = reconciliationService.reconcile(accountId);

            assertTrue(report.isBalanced());
            assertEquals(0, new BigDecimal("300.01").compareTo(report.getTransactionTotal()));
            assertEquals(0, new BigDecimal("1300.01").compareTo(report.getActualBalance()));
            assertEquals(0, report.getExpectedBalance().compareTo(report.getActualBalance()));

            printInvariant("balance = initial + sum(signed amounts)");
        }

        @Test
        @DisplayName("4.2 Unknown account is AccountNotFound")
        void unknownAccount() {
            assertThrows(AccountNotFoundException.class,
                    () -> reconciliationService.reconcile("NOPE-" + UUID.randomUUID()));
        }
    }

    @Test
    @DisplayName("Opening an account with a negative balance is rejected")
    void openAccountNegative() {
        assertThrows(IllegalArgumentException.class,
                () -> accountService.openAccount("NEG-" + UUID.randomUUID(), "x", new BigDecimal("-1.00")));
    }
}
