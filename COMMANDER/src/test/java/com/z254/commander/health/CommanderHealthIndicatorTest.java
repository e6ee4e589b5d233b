package com.z254.commander.health;

import com.z254.commander.broadcast.BatchScheduler;
import com.z254.commander.broadcast.ConnectionRegistry;
import com.z254.commander.config.CommanderProperties;
import com.z254.commander.orchestration.RealTimeOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CommanderHealthIndicator}.
 */
@ExtendWith(MockitoExtension.class)
class CommanderHealthIndicatorTest {

    @Mock
    private BatchScheduler batchScheduler;

    @Mock
    private ConnectionRegistry connectionRegistry;

    @Mock
    private RealTimeOrchestrator orchestrator;

    private CommanderHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new CommanderHealthIndicator(batchScheduler, connectionRegistry, orchestrator,
                new CommanderProperties());
        when(connectionRegistry.activeConnections()).thenReturn(2);
        when(connectionRegistry.maxConnections()).thenReturn(2);
        when(orchestrator.activeIncidentIds()).thenReturn(Set.of("inc-1"));
        when(batchScheduler.pendingCount()).thenReturn(0);
    }

    @Test
    @DisplayName("should report UP with capacity details while the scheduler runs")
    void upWhenRunning() {
        when(batchScheduler.state()).thenReturn(BatchScheduler.State.RUNNING);
        when(batchScheduler.isRunning()).thenReturn(true);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("connectionCapacity", "AT_LIMIT")
                            .containsEntry("incidents.active", 1)
                            .containsEntry("incidentCapacity", "AVAILABLE");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report DOWN while the scheduler is stopped")
    void downWhenStopped() {
        when(batchScheduler.state()).thenReturn(BatchScheduler.State.STOPPED);
        when(batchScheduler.isRunning()).thenReturn(false);

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("batchScheduler.state", "STOPPED");
                })
                .verifyComplete();
    }
}
