package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.error.BalanceConstraintViolationException;
import com.flagship.banking_ledger.error.LedgerException;
import com.flagship.banking_ledger.error.StorageFailureException;
import com.flagship.banking_ledger.error.StorageTimeoutException;
import com.flagship.banking_ledger.interest.InterestRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link LedgerStore} over JDBC. Each atomic unit is one database transaction; account rows are
 * locked with {@code SELECT ... FOR UPDATE} and held until commit or rollback.
 *
 * Driver and transaction-manager exceptions are translated here so that callers only ever see
 * {@link LedgerException} subtypes. Programming errors raised inside a unit (such as
 * {@link IllegalStateException}) roll the unit back and propagate unchanged. The bean is a plain
 * {@code @Component}: a {@code @Repository} proxy would re-translate those into
 * {@link DataAccessException}s after {@link #translate} has run.
 */
@Slf4j
@Component
public class JdbcLedgerStore implements LedgerStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate,
                           @Qualifier("ledgerTransactionTemplate") TransactionTemplate transactionTemplate,
                           Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public <T> T inAtomicUnit(Function<LedgerUnit, T> work) {
        return translate(() -> transactionTemplate.execute(status -> work.apply(new JdbcLedgerUnit(jdbcTemplate, clock))));
    }

    @Override
    public Optional<Account> findAccount(String accountId) {
        return translate(() -> jdbcTemplate.query(
            "SELECT " + LedgerRowMappers.ACCOUNT_COLUMNS + " FROM accounts WHERE account_id = ?",
            LedgerRowMappers.ACCOUNT,
            accountId
        ).stream().findFirst());
    }

    @Override
    public List<String> findAllAccountIds() {
        return translate(() -> jdbcTemplate.queryForList(
            "SELECT account_id FROM accounts ORDER BY account_id",
            String.class
        ));
    }

    @Override
    public List<Transaction> getRecentTransactions(String accountId, int limit) {
        return translate(() -> jdbcTemplate.query(
            "SELECT " + LedgerRowMappers.TRANSACTION_COLUMNS + " FROM transactions WHERE account_id = ? " +
            "ORDER BY transaction_timestamp DESC, transaction_id DESC LIMIT ?",
            LedgerRowMappers.TRANSACTION,
            accountId,
            limit
        ));
    }

    @Override
    public List<Transaction> findTransactionsByTransferId(UUID transferId) {
        return translate(() -> jdbcTemplate.query(
            "SELECT " + LedgerRowMappers.TRANSACTION_COLUMNS + " FROM transactions WHERE transfer_id = ? " +
            "ORDER BY transaction_id",
            LedgerRowMappers.TRANSACTION,
            transferId
        ));
    }

    @Override
    public List<InterestRecord> getInterestHistory(String accountId) {
        return translate(() -> jdbcTemplate.query(
            "SELECT " + LedgerRowMappers.INTEREST_COLUMNS + " FROM interest_history WHERE account_id = ? " +
            "ORDER BY calculation_date DESC, id DESC",
            LedgerRowMappers.INTEREST,
            accountId
        ));
    }

    @Override
    public BigDecimal sumAccruedInterest(String accountId) {
        return translate(() -> orZero(jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(calculated_interest), 0) FROM interest_history WHERE account_id = ?",
            BigDecimal.class,
            accountId
        )));
    }

    @Override
    public BigDecimal sumSignedTransactions(String accountId) {
        return translate(() -> orZero(jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE " +
            "  WHEN type IN ('DEPOSIT', 'TRANSFER_IN') THEN amount " +
            "  ELSE -amount END), 0) " +
            "FROM transactions WHERE account_id = ?",
            BigDecimal.class,
            accountId
        )));
    }

    @Override
    public Optional<UUID> findTransferIdByIdempotencyKey(String idempotencyKey) {
        return translate(() -> jdbcTemplate.query(
            "SELECT transfer_id FROM transfer_idempotency_keys WHERE idempotency_key = ?",
            (rs, rowNum) -> rs.getObject("transfer_id", UUID.class),
            idempotencyKey
        ).stream().findFirst());
    }

    @Override
    public Account createAccount(String accountId, String customerName, BigDecimal initialBalance) {
        Instant createdAt = LedgerRowMappers.truncate(clock.instant());
        BigDecimal opening = Amounts.scaled(initialBalance);
        translate(() -> jdbcTemplate.update(
            "INSERT INTO accounts (account_id, customer_name, balance, initial_balance, created_at) " +
            "VALUES (?, ?, ?, ?, ?)",
            accountId,
            customerName,
            opening,
            opening,
            LedgerRowMappers.toColumn(createdAt)
        ));
        log.info("Opened account {} for {} with balance {}", accountId, customerName, opening);
        return new Account(accountId, customerName, opening, opening, createdAt);
    }

    private <T> T translate(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (LedgerException e) {
            throw e;
        } catch (QueryTimeoutException | PessimisticLockingFailureException e) {
            log.warn("Ledger storage timed out: {}", e.getMessage());
            throw new StorageTimeoutException("Storage operation timed out", e);
        } catch (TransactionTimedOutException e) {
            log.warn("Ledger unit exceeded its deadline: {}", e.getMessage());
            throw new StorageTimeoutException("Storage operation timed out", e);
        } catch (DataIntegrityViolationException e) {
            log.warn("Ledger constraint violated: {}", e.getMessage());
            throw new BalanceConstraintViolationException("Storage constraint violated", e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Ledger storage failure", e);
            throw new StorageFailureException("Storage operation failed", e);
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
