package com.flagship.banking_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Transaction scope for ledger atomic units and the clock that stamps ledger rows.
 */
@Configuration
public class TransactionConfig {

    /**
     * Every atomic unit runs with a deadline so that a unit stuck behind a row lock
     * fails with a storage timeout instead of waiting forever.
     */
    @Bean
    public TransactionTemplate ledgerTransactionTemplate(
            PlatformTransactionManager transactionManager,
            @Value("${ledger.storage.timeout-seconds:10}") int timeoutSeconds) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setTimeout(timeoutSeconds);
        return template;
    }

    @Bean
    public Clock ledgerClock(@Value("${ledger.interest.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
