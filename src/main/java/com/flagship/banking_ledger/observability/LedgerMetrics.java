package com.flagship.banking_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger operations.
 *
 * - ledger.operations{operation,outcome}: one count per deposit, withdrawal, transfer or accrual attempt
 * - ledger.operation.latency{operation}: wall time of the operation including its atomic unit
 * - ledger.interest.accrued.accounts: accounts credited by accrual runs
 * - ledger.idempotency.cache{result}: transfer replays (hit) versus first submissions (miss)
 */
@Component
public class LedgerMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_PARTIAL = "partial";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;
    private final Counter interestAccruedAccounts;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.interestAccruedAccounts = Counter.builder("ledger.interest.accrued.accounts")
                .description("Number of accounts credited with daily interest")
                .register(registry);
    }

    /**
     * @param outcome {@link #OUTCOME_SUCCESS}, {@link #OUTCOME_PARTIAL} for an accrual run with failed
     *                accounts, the error kind that ended the operation, or {@link #OUTCOME_ERROR}
     *                for a failure outside the ledger taxonomy
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordInterestAccrued(int accounts) {
        interestAccruedAccounts.increment(accounts);
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values short and alphanumeric to bound cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
