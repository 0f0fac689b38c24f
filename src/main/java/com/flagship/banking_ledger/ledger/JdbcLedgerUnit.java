package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.error.AccountNotFoundException;
import com.flagship.banking_ledger.error.BalanceConstraintViolationException;
import com.flagship.banking_ledger.interest.InterestRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * JDBC unit of work. Only valid inside the transaction opened by {@link JdbcLedgerStore#inAtomicUnit}.
 *
 * Unstamped drafts take the clock's time after their account rows are locked: a mutation that
 * queued behind another unit is always stamped later than the one it waited for.
 */
@Slf4j
class JdbcLedgerUnit implements LedgerUnit {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    JdbcLedgerUnit(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Account lockAccount(String accountId) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT " + LedgerRowMappers.ACCOUNT_COLUMNS + " FROM accounts WHERE account_id = ? FOR UPDATE",
            LedgerRowMappers.ACCOUNT,
            accountId
        );
        if (rows.isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }
        return rows.get(0);
    }

    @Override
    public Transaction post(Account lockedAccount, BalanceMutation mutation, TransactionDraft draft) {
        return post(lockedAccount, mutation, draft, draft.timestampOr(clock.instant()));
    }

    private Transaction post(Account lockedAccount, BalanceMutation mutation, TransactionDraft draft,
                             Instant stampedAt) {
        BigDecimal delta = mutation.delta(lockedAccount);
        BigDecimal expected = draft.getType().signed(draft.getAmount());
        if (delta.compareTo(expected) != 0) {
            throw new IllegalStateException(String.format(
                "Balance delta %s does not match %s of %s", delta, draft.getType(), draft.getAmount()));
        }

        BigDecimal newBalance = lockedAccount.getBalance().add(delta);
        if (newBalance.signum() < 0) {
            throw new BalanceConstraintViolationException(String.format(
                "Balance of account %s would become negative: %s", lockedAccount.getAccountId(), newBalance));
        }

        jdbcTemplate.update(
            "UPDATE accounts SET balance = ? WHERE account_id = ?",
            newBalance,
            lockedAccount.getAccountId()
        );

        Instant timestamp = LedgerRowMappers.truncate(stampedAt);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                "INSERT INTO transactions (account_id, type, amount, balance_after, transaction_timestamp, " +
                "description, transfer_id) VALUES (?, ?, ?, ?, ?, ?, ?)",
                new String[]{"transaction_id"});
            ps.setString(1, lockedAccount.getAccountId());
            ps.setString(2, draft.getType().name());
            ps.setBigDecimal(3, draft.getAmount());
            ps.setBigDecimal(4, newBalance);
            ps.setObject(5, LedgerRowMappers.toColumn(timestamp));
            ps.setString(6, draft.getDescription());
            ps.setObject(7, draft.getTransferId());
            return ps;
        }, keyHolder);

        long transactionId = Objects.requireNonNull(keyHolder.getKey(), "transaction_id not generated").longValue();
        log.debug("Posted {} {} to account {} (balance {})",
            draft.getType(), draft.getAmount(), lockedAccount.getAccountId(), newBalance);

        return new Transaction(
            transactionId,
            lockedAccount.getAccountId(),
            draft.getType(),
            draft.getAmount(),
            newBalance,
            timestamp,
            draft.getDescription(),
            draft.getTransferId()
        );
    }

    @Override
    public Transaction apply(String accountId, BalanceMutation mutation, TransactionDraft draft) {
        return post(lockAccount(accountId), mutation, draft);
    }

    @Override
    public List<Transaction> applyPair(Leg first, Leg second) {
        if (first.getAccountId().equals(second.getAccountId())) {
            throw new IllegalArgumentException("Both legs target account " + first.getAccountId());
        }
        Account firstAccount = lockAccount(first.getAccountId());
        Account secondAccount = lockAccount(second.getAccountId());

        Instant lockTime = clock.instant();
        Transaction firstPosted = post(firstAccount, first.getMutation(), first.getDraft(),
            first.getDraft().timestampOr(lockTime));
        Transaction secondPosted = post(secondAccount, second.getMutation(), second.getDraft(),
            second.getDraft().timestampOr(lockTime));
        return List.of(firstPosted, secondPosted);
    }

    @Override
    public boolean hasInterestFor(String accountId, LocalDate calculationDate) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM interest_history WHERE account_id = ? AND calculation_date = ?",
            Integer.class,
            accountId,
            calculationDate
        );
        return count != null && count > 0;
    }

    @Override
    public InterestRecord recordInterest(String accountId, BigDecimal interestRate, BigDecimal calculatedInterest,
                                         LocalDate calculationDate, long transactionId) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                "INSERT INTO interest_history (account_id, interest_rate, calculated_interest, " +
                "calculation_date, transaction_id) VALUES (?, ?, ?, ?, ?)",
                new String[]{"id"});
            ps.setString(1, accountId);
            ps.setBigDecimal(2, interestRate);
            ps.setBigDecimal(3, calculatedInterest);
            ps.setObject(4, calculationDate);
            ps.setLong(5, transactionId);
            return ps;
        }, keyHolder);

        long id = Objects.requireNonNull(keyHolder.getKey(), "interest_history id not generated").longValue();
        return new InterestRecord(id, accountId, interestRate, calculatedInterest, calculationDate, transactionId);
    }

    @Override
    public void claimIdempotencyKey(String idempotencyKey, UUID transferId) {
        try {
            jdbcTemplate.update(
                "INSERT INTO transfer_idempotency_keys (idempotency_key, transfer_id) VALUES (?, ?)",
                idempotencyKey,
                transferId
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateIdempotencyKeyException(idempotencyKey, e);
        }
    }
}
