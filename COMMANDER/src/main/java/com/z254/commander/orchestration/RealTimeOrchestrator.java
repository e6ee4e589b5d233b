package com.z254.commander.orchestration;

import com.z254.commander.domain.model.Incident;
import com.z254.commander.domain.model.IncidentPhase;
import com.z254.commander.domain.model.SystemHealthMetrics;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * Drives incidents through the phase sequence and streams every transition to dashboards.
 */
public interface RealTimeOrchestrator {

    /**
     * Process an incident through detection, diagnosis, prediction and resolution, plus
     * verification when a callback is registered for it.
     * Fails with the phase's error as soon as any phase fails or times out; no further
     * phases run.
     *
     * @param incident  The incident to process
     * @param callbacks Agent per phase; a missing entry completes that phase immediately
     * @return Processing summary
     */
    Mono<IncidentProcessingResult> processIncident(Incident incident, Map<IncidentPhase, PhaseCallback> callbacks);

    /**
     * Compute current system health. Does not change orchestrator state.
     *
     * @return Health snapshot
     */
    SystemHealthMetrics getSystemHealth();

    /**
     * Queue a system health snapshot for all dashboards.
     */
    void broadcastSystemHealth();

    /**
     * Ids of incidents currently being processed.
     */
    Set<String> activeIncidentIds();
}
