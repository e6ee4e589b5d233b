package com.z254.commander.health;

import com.z254.commander.broadcast.BatchScheduler;
import com.z254.commander.broadcast.ConnectionRegistry;
import com.z254.commander.config.CommanderProperties;
import com.z254.commander.orchestration.RealTimeOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for COMMANDER.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Batch scheduler state (DOWN while stopped)</li>
 *     <li>Dashboard connection capacity</li>
 *     <li>Incident processing capacity</li>
 * </ul>
 */
@Component
public class CommanderHealthIndicator implements ReactiveHealthIndicator {

    private final BatchScheduler batchScheduler;
    private final ConnectionRegistry connectionRegistry;
    private final RealTimeOrchestrator orchestrator;
    private final CommanderProperties properties;

    public CommanderHealthIndicator(BatchScheduler batchScheduler,
                                    ConnectionRegistry connectionRegistry,
                                    RealTimeOrchestrator orchestrator,
                                    CommanderProperties properties) {
        this.batchScheduler = batchScheduler;
        this.connectionRegistry = connectionRegistry;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();

        details.put("batchScheduler.state", batchScheduler.state().name());
        details.put("batchScheduler.pending", batchScheduler.pendingCount());

        int connections = connectionRegistry.activeConnections();
        int maxConnections = connectionRegistry.maxConnections();
        details.put("connections.active", connections);
        details.put("connections.max", maxConnections);
        details.put("connectionCapacity", connections >= maxConnections ? "AT_LIMIT" : "AVAILABLE");

        int incidents = orchestrator.activeIncidentIds().size();
        int maxIncidents = properties.getOrchestrator().getMaxConcurrentIncidents();
        details.put("incidents.active", incidents);
        details.put("incidents.max", maxIncidents);
        details.put("incidentCapacity", incidents >= maxIncidents ? "AT_LIMIT" : "AVAILABLE");

        if (batchScheduler.isRunning()) {
            return Health.up().withDetails(details).build();
        }
        return Health.down().withDetails(details).build();
    }
}
