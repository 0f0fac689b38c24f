package com.flagship.banking_ledger.interest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the daily accrual on {@code ledger.interest.cron}. Off unless
 * {@code ledger.interest.scheduler.enabled=true}; the HTTP trigger works either way.
 */
@Component
@ConditionalOnProperty(name = "ledger.interest.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class InterestAccrualScheduler {

    private final InterestAccrualEngine engine;

    @Scheduled(cron = "${ledger.interest.cron:0 5 0 * * *}", zone = "${ledger.interest.zone:UTC}")
    public void accrueDailyInterest() {
        try {
            engine.accrueDaily();
        } catch (Exception e) {
            log.error("Scheduled interest accrual failed", e);
        }
    }
}
