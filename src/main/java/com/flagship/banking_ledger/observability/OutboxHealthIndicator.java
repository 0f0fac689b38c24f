package com.flagship.banking_ledger.observability;

import com.flagship.banking_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the outbox as UP, WARNING or DOWN by backlog size, with dead-lettered events as detail.
 */
@Component("outboxHealth")
public class OutboxHealthIndicator implements HealthIndicator {

    static final long BACKLOG_WARNING_THRESHOLD = 1000;
    static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

    private final OutboxEventRepository outboxRepository;
    private final int maxRetries;

    public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                 @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.maxRetries = maxRetries;
    }

    @Override
    public Health health() {
        try {
            long backlogSize = outboxRepository.countUnpublished();

            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("deadLettered", outboxRepository.countDeadLettered(maxRetries))
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
