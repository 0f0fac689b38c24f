package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.error.AccountNotFoundException;
import com.flagship.banking_ledger.error.LedgerException;
import com.flagship.banking_ledger.interest.InterestCredit;
import com.flagship.banking_ledger.interest.InterestRecord;
import com.flagship.banking_ledger.observability.CorrelationContext;
import com.flagship.banking_ledger.observability.LedgerMetrics;
import com.flagship.banking_ledger.outbox.OutboxService;
import com.flagship.banking_ledger.outbox.event.FundsDepositedEvent;
import com.flagship.banking_ledger.outbox.event.FundsWithdrawnEvent;
import com.flagship.banking_ledger.outbox.event.InterestAccruedEvent;
import com.flagship.banking_ledger.query.AccountInfo;
import com.flagship.banking_ledger.query.AccountQueryFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.function.Supplier;

/**
 * Single-account money movements.
 *
 * Every mutation is one atomic unit of the {@link LedgerStore}: the account row is locked,
 * the balance rule is evaluated against the locked balance, and the new balance, the appended
 * transaction and the outbox event commit together. Nothing here reads a balance outside
 * that unit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final String DEPOSIT_DESCRIPTION = "Deposit";
    private static final String WITHDRAWAL_DESCRIPTION = "Withdrawal";

    private final LedgerStore ledgerStore;
    private final AccountQueryFacade queryFacade;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * Credits {@code amount} to the account.
     *
     * @return the balance after the deposit
     * @throws com.flagship.banking_ledger.error.InvalidAmountException if amount is not a positive cent amount
     * @throws AccountNotFoundException if the account does not exist
     */
    public BigDecimal deposit(String accountId, BigDecimal amount) {
        return tracked("deposit", accountId, () -> {
            BigDecimal validAmount = Amounts.requirePositive(amount);
            requireAccountId(accountId);

            Transaction deposit = ledgerStore.inAtomicUnit(unit -> {
                Transaction posted = postDeposit(unit, unit.lockAccount(accountId), validAmount, DEPOSIT_DESCRIPTION);
                outboxService.saveEvent(OutboxService.ACCOUNT_AGGREGATE, accountId, FundsDepositedEvent.from(posted));
                return posted;
            });

            log.info("Deposit committed: amount={}, balance={}, transactionId={}",
                    validAmount, deposit.getBalanceAfter(), deposit.getTransactionId());
            return deposit.getBalanceAfter();
        });
    }

    /**
     * Debits {@code amount} from the account. Funds are checked against the locked balance
     * inside the same unit that writes the debit.
     *
     * @return the balance after the withdrawal
     * @throws com.flagship.banking_ledger.error.InsufficientFundsException if the balance does not cover the amount
     */
    public BigDecimal withdraw(String accountId, BigDecimal amount) {
        return tracked("withdrawal", accountId, () -> {
            BigDecimal validAmount = Amounts.requirePositive(amount);
            requireAccountId(accountId);

            Transaction withdrawal = ledgerStore.inAtomicUnit(unit -> {
                Transaction posted = unit.apply(accountId, BalanceMutation.debit(validAmount),
                        TransactionDraft.of(TransactionType.WITHDRAWAL, validAmount, WITHDRAWAL_DESCRIPTION));
                outboxService.saveEvent(OutboxService.ACCOUNT_AGGREGATE, accountId, FundsWithdrawnEvent.from(posted));
                return posted;
            });

            log.info("Withdrawal committed: amount={}, balance={}, transactionId={}",
                    validAmount, withdrawal.getBalanceAfter(), withdrawal.getTransactionId());
            return withdrawal.getBalanceAfter();
        });
    }

    public AccountInfo getAccountInfo(String accountId) {
        return queryFacade.getAccountInfo(accountId);
    }

    /**
     * Credits one day of interest through the deposit path.
     *
     * Runs as its own atomic unit. The day key is checked after the row lock is taken,
     * so two concurrent runs for the same date cannot both credit the account.
     */
    public InterestCredit creditInterest(String accountId, BigDecimal dailyRate, LocalDate calculationDate) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId);
        try {
            return ledgerStore.inAtomicUnit(unit -> {
                Account account = unit.lockAccount(accountId);
                if (unit.hasInterestFor(accountId, calculationDate)) {
                    return InterestCredit.alreadyAccrued(accountId);
                }

                BigDecimal interest = Amounts.scaled(account.getBalance().multiply(dailyRate));
                if (interest.signum() <= 0) {
                    return InterestCredit.zeroInterest(accountId);
                }

                String description = String.format("Daily interest %s @ %s", calculationDate, dailyRate.toPlainString());
                Transaction deposit = postDeposit(unit, account, interest, description);
                InterestRecord record = unit.recordInterest(
                        accountId, dailyRate, interest, calculationDate, deposit.getTransactionId());
                outboxService.saveEvent(OutboxService.ACCOUNT_AGGREGATE, accountId,
                        InterestAccruedEvent.from(record, deposit));

                log.debug("Interest credited: interest={}, balance={}", interest, deposit.getBalanceAfter());
                return InterestCredit.credited(record, deposit);
            });
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    /**
     * Seeds an account. Account opening is not a ledger operation; this exists for data setup.
     */
    public Account openAccount(String accountId, String customerName, BigDecimal initialBalance) {
        requireAccountId(accountId);
        if (initialBalance == null || initialBalance.signum() < 0) {
            throw new IllegalArgumentException("Initial balance must be zero or positive");
        }
        return ledgerStore.createAccount(accountId, customerName, initialBalance);
    }

    private Transaction postDeposit(LedgerUnit unit, Account lockedAccount, BigDecimal amount, String description) {
        return unit.post(lockedAccount, BalanceMutation.credit(amount),
                TransactionDraft.of(TransactionType.DEPOSIT, amount, description));
    }

    private static void requireAccountId(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new AccountNotFoundException(String.valueOf(accountId));
        }
    }

    private <T> T tracked(String operation, String accountId, Supplier<T> work) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(accountId));
        try {
            T result = work.get();
            metrics.recordOperation(operation, LedgerMetrics.OUTCOME_SUCCESS);
            return result;
        } catch (LedgerException e) {
            metrics.recordOperation(operation, e.getKind().name());
            if (e.getKind().isInternal()) {
                log.error("{} failed: kind={}, error={}", operation, e.getKind(), e.getMessage(), e);
            } else {
                log.warn("{} rejected: kind={}, reason={}", operation, e.getKind(), e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, LedgerMetrics.OUTCOME_ERROR);
            log.error("{} failed: {}", operation, e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }
}
