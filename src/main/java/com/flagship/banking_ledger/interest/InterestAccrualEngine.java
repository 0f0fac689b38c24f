package com.flagship.banking_ledger.interest;

import com.flagship.banking_ledger.error.LedgerException;
import com.flagship.banking_ledger.ledger.AccountService;
import com.flagship.banking_ledger.ledger.LedgerStore;
import com.flagship.banking_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Daily interest accrual over every account.
 *
 * Each account is credited in its own atomic unit through {@link AccountService#creditInterest},
 * so a failing account is counted and skipped while the others still commit. Accrual is
 * keyed by (account, calculation date): re-running a date credits nothing twice.
 */
@Service
@Slf4j
public class InterestAccrualEngine {

    private final LedgerStore ledgerStore;
    private final AccountService accountService;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final BigDecimal dailyRate;

    public InterestAccrualEngine(LedgerStore ledgerStore,
                                 AccountService accountService,
                                 LedgerMetrics metrics,
                                 Clock clock,
                                 @Value("${ledger.interest.daily-rate:0.0005}") BigDecimal dailyRate) {
        if (dailyRate.signum() < 0) {
            throw new IllegalArgumentException("ledger.interest.daily-rate must not be negative: " + dailyRate);
        }
        this.ledgerStore = ledgerStore;
        this.accountService = accountService;
        this.metrics = metrics;
        this.clock = clock;
        this.dailyRate = dailyRate;
    }

    /**
     * Accrues interest for today in the configured zone.
     */
    public AccrualSummary accrueDaily() {
        return accrueDaily(LocalDate.now(clock));
    }

    /**
     * @throws com.flagship.banking_ledger.error.StorageFailureException if the account list cannot be read
     */
    public AccrualSummary accrueDaily(LocalDate calculationDate) {
        long startTime = System.currentTimeMillis();
        List<String> accountIds = ledgerStore.findAllAccountIds();
        log.info("Starting interest accrual for {}: accounts={}, rate={}",
                calculationDate, accountIds.size(), dailyRate.toPlainString());

        int credited = 0;
        int alreadyAccrued = 0;
        int zeroInterest = 0;
        int failed = 0;
        BigDecimal totalInterest = BigDecimal.ZERO.setScale(2);

        for (String accountId : accountIds) {
            try {
                InterestCredit credit = accountService.creditInterest(accountId, dailyRate, calculationDate);
                switch (credit.getStatus()) {
                    case CREDITED -> {
                        credited++;
                        totalInterest = totalInterest.add(credit.getCreditedAmount());
                    }
                    case ALREADY_ACCRUED -> alreadyAccrued++;
                    case ZERO_INTEREST -> zeroInterest++;
                }
            } catch (LedgerException e) {
                failed++;
                metrics.recordOperation("interest", e.getKind().name());
                log.error("Interest accrual failed for account {}: kind={}, error={}",
                        accountId, e.getKind(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                metrics.recordOperation("interest", LedgerMetrics.OUTCOME_ERROR);
                log.error("Interest accrual failed for account {}", accountId, e);
            }
        }

        metrics.recordInterestAccrued(credited);
        metrics.recordOperation("interest", failed > 0 ? LedgerMetrics.OUTCOME_PARTIAL : LedgerMetrics.OUTCOME_SUCCESS);
        metrics.recordLatency("interest", System.currentTimeMillis() - startTime);

        AccrualSummary summary = new AccrualSummary(calculationDate, dailyRate, credited, alreadyAccrued,
                zeroInterest, failed, totalInterest);
        log.info("Interest accrual finished for {}: credited={}, alreadyAccrued={}, zeroInterest={}, failed={}, total={}",
                calculationDate, credited, alreadyAccrued, zeroInterest, failed, totalInterest);
        return summary;
    }
}
