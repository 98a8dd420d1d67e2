package com.delta.ingestion.incremental.service;

import com.delta.ingestion.config.IngestionProperties;
import com.delta.ingestion.incremental.model.SchedulerStatusResponse;
import com.delta.ingestion.incremental.model.TickOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionSchedulerServiceTest {

    @Mock
    private IngestionStateMachine stateMachine;

    @Mock
    private IncrementalProviderRegistry registry;

    @Test
    void failingProviderDoesNotStopTheRound() {
        when(registry.providerNames()).thenReturn(List.of("alpha", "beta", "gamma"));
        when(stateMachine.tick("alpha")).thenReturn(TickOutcome.WAITING);
        when(stateMachine.tick("beta")).thenThrow(new ConcurrentTransitionException("lost twice"));
        when(stateMachine.tick("gamma")).thenReturn(TickOutcome.COMPLETED);

        IngestionSchedulerService scheduler = new IngestionSchedulerService(stateMachine, registry, new IngestionProperties());

        assertEquals(1, scheduler.tickAll());
        verify(stateMachine).tick("gamma");
    }

    @Test
    void startAndStopAreIdempotent() {
        when(registry.providerNames()).thenReturn(List.of());
        IngestionProperties properties = new IngestionProperties();
        properties.getScheduler().setWorkerCount(2);
        properties.getScheduler().setPollIntervalMs(100);
        IngestionSchedulerService scheduler = new IngestionSchedulerService(stateMachine, registry, properties);

        scheduler.start();
        scheduler.start();
        SchedulerStatusResponse running = scheduler.getStatus();
        assertTrue(running.running());
        assertEquals(2, running.workerCount());

        scheduler.stop();
        scheduler.stop();
        SchedulerStatusResponse stopped = scheduler.getStatus();
        assertFalse(stopped.running());
        assertEquals(0, stopped.workerCount());
        assertThat(stopped.providers()).isEmpty();
    }
}
