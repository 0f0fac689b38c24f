package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.interest.InterestRecord;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Row mappers and column conversions shared by the store and its units.
 * Timestamps are written as UTC {@link OffsetDateTime} at microsecond precision.
 */
final class LedgerRowMappers {

    static final String ACCOUNT_COLUMNS =
        "account_id, customer_name, balance, initial_balance, created_at";

    static final String TRANSACTION_COLUMNS =
        "transaction_id, account_id, type, amount, balance_after, transaction_timestamp, description, transfer_id";

    static final String INTEREST_COLUMNS =
        "id, account_id, interest_rate, calculated_interest, calculation_date, transaction_id";

    static final RowMapper<Account> ACCOUNT = (rs, rowNum) -> new Account(
        rs.getString("account_id"),
        rs.getString("customer_name"),
        rs.getBigDecimal("balance"),
        rs.getBigDecimal("initial_balance"),
        instant(rs, "created_at")
    );

    static final RowMapper<Transaction> TRANSACTION = (rs, rowNum) -> new Transaction(
        rs.getLong("transaction_id"),
        rs.getString("account_id"),
        TransactionType.valueOf(rs.getString("type")),
        rs.getBigDecimal("amount"),
        rs.getBigDecimal("balance_after"),
        instant(rs, "transaction_timestamp"),
        rs.getString("description"),
        rs.getObject("transfer_id", UUID.class)
    );

    static final RowMapper<InterestRecord> INTEREST = (rs, rowNum) -> new InterestRecord(
        rs.getLong("id"),
        rs.getString("account_id"),
        rs.getBigDecimal("interest_rate"),
        rs.getBigDecimal("calculated_interest"),
        rs.getObject("calculation_date", LocalDate.class),
        rs.getLong("transaction_id")
    );

    private LedgerRowMappers() {
    }

    static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    static OffsetDateTime toColumn(Instant instant) {
        return OffsetDateTime.ofInstant(truncate(instant), ZoneOffset.UTC);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }
}
