package com.z254.commander.orchestration;

import com.z254.commander.broadcast.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically pushes a system health snapshot to connected dashboards.
 */
@Slf4j
@Component
public class SystemHealthBroadcaster {

    private final RealTimeOrchestrator orchestrator;
    private final ConnectionRegistry registry;

    public SystemHealthBroadcaster(RealTimeOrchestrator orchestrator, ConnectionRegistry registry) {
        this.orchestrator = orchestrator;
        this.registry = registry;
    }

    @Scheduled(fixedDelayString = "${commander.broadcast.health-broadcast-interval:PT5S}")
    public void broadcastHealth() {
        if (registry.activeConnections() == 0) {
            return;
        }
        orchestrator.broadcastSystemHealth();
        log.debug("Queued system health snapshot for {} dashboards", registry.activeConnections());
    }
}
