package com.flagship.banking_ledger.observability;

import com.flagship.banking_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboxMetricsTest {

    @Test
    @DisplayName("Scheduled refresh updates the backlog gauges from the repository")
    void refreshUpdatesGauges() {
        OutboxEventRepository repository = mock(OutboxEventRepository.class);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        OutboxMetrics metrics = new OutboxMetrics(repository, registry);
        ReflectionTestUtils.setField(metrics, "maxRetries", 5);
        metrics.init();

        when(repository.countUnpublished()).thenReturn(7L);
        when(repository.findOldestUnpublishedCreatedAt()).thenReturn(Optional.of(Instant.now().minusSeconds(120)));
        when(repository.countDeadLettered(5)).thenReturn(2L);

        new MetricsScheduler(metrics).refreshOutboxMetrics();

        assertEquals(7L, metrics.getBacklogSize());
        assertEquals(7.0, registry.get("outbox.backlog.size").gauge().value());
        assertEquals(2.0, registry.get("outbox.events.failed").gauge().value());
        assertTrue(registry.get("outbox.backlog.age.seconds").gauge().value() >= 120.0);
        verify(repository).countDeadLettered(5);
    }

    @Test
    @DisplayName("A failing refresh keeps the previous values")
    void refreshFailureContained() {
        OutboxEventRepository repository = mock(OutboxEventRepository.class);
        OutboxMetrics metrics = new OutboxMetrics(repository, new SimpleMeterRegistry());
        metrics.init();
        when(repository.countUnpublished()).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(metrics::refreshMetrics);
        assertEquals(0L, metrics.getBacklogSize());
    }
}
