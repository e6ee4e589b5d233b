package com.z254.commander.orchestration;

import com.z254.commander.broadcast.BroadcastFacade;
import com.z254.commander.broadcast.ConnectionRegistry;
import com.z254.commander.broadcast.RegistryMetrics;
import com.z254.commander.config.CommanderProperties;
import com.z254.commander.domain.model.AgentState;
import com.z254.commander.domain.model.ErrorContext;
import com.z254.commander.domain.model.Incident;
import com.z254.commander.domain.model.IncidentPhase;
import com.z254.commander.domain.model.Severity;
import com.z254.commander.domain.model.SystemHealthMetrics;
import com.z254.commander.observability.CommanderMetrics;
import com.z254.commander.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Implementation of the real-time orchestrator.
 */
@Slf4j
@Service
public class RealTimeOrchestratorImpl implements RealTimeOrchestrator {

    private final BroadcastFacade broadcastFacade;
    private final ConnectionRegistry connectionRegistry;
    private final CommanderMetrics metrics;
    private final StructuredLogger structuredLogger;
    private final CommanderProperties.OrchestratorProperties config;
    private final PhaseTimings timings;
    private final AgentExecutionTracker tracker;

    // Active runs keyed by incident id
    private final Map<String, IncidentRun> activeRuns = new ConcurrentHashMap<>();

    public RealTimeOrchestratorImpl(BroadcastFacade broadcastFacade,
                                    ConnectionRegistry connectionRegistry,
                                    CommanderMetrics metrics,
                                    StructuredLogger structuredLogger,
                                    CommanderProperties properties) {
        this.broadcastFacade = broadcastFacade;
        this.connectionRegistry = connectionRegistry;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = properties.getOrchestrator();
        this.timings = new PhaseTimings(config.getTimingWindow());
        this.tracker = new AgentExecutionTracker(broadcastFacade, metrics, structuredLogger,
                timings, config.getPhaseTimeout());
    }

    @Override
    public Mono<IncidentProcessingResult> processIncident(Incident incident,
                                                          Map<IncidentPhase, PhaseCallback> callbacks) {
        return Mono.defer(() -> {
            Objects.requireNonNull(incident, "incident");
            String incidentId = Objects.requireNonNull(incident.getId(), "incident.id");
            Map<IncidentPhase, PhaseCallback> agents = callbacks != null ? callbacks : Map.of();
            List<IncidentPhase> phases = phasesFor(agents);

            IncidentRun run = new IncidentRun(incidentId, phases);
            if (activeRuns.putIfAbsent(incidentId, run) != null) {
                return Mono.error(new IllegalStateException("Incident already being processed: " + incidentId));
            }

            metrics.recordIncidentStarted();
            structuredLogger.inContext(incidentId, null, () -> {
                structuredLogger.logIncidentStarted(incidentId, phases.size());
                log.info("Starting real-time processing for incident {} ({} phases)", incidentId, phases.size());
            });

            AtomicBoolean finished = new AtomicBoolean();
            return Flux.fromIterable(phases)
                    .concatMap(phase -> processPhase(run, incident, phase, agents.get(phase)))
                    .then(Mono.fromCallable(() -> complete(run, incident)))
                    .doOnSuccess(result -> {
                        finished.set(true);
                        release(run);
                    })
                    .doOnError(error -> {
                        finished.set(true);
                        fail(run, error);
                        release(run);
                    })
                    .doOnCancel(() -> {
                        if (finished.compareAndSet(false, true)) {
                            structuredLogger.inContext(incidentId, run.currentPhase(),
                                    () -> log.warn("Processing of incident {} cancelled", incidentId));
                            metrics.recordIncidentFailed();
                            release(run);
                        }
                    });
        });
    }

    private List<IncidentPhase> phasesFor(Map<IncidentPhase, PhaseCallback> agents) {
        List<IncidentPhase> phases = new ArrayList<>(IncidentPhase.requiredPhases());
        if (agents.containsKey(IncidentPhase.VERIFICATION)) {
            phases.add(IncidentPhase.VERIFICATION);
        }
        return phases;
    }

    private Mono<Void> processPhase(IncidentRun run, Incident incident, IncidentPhase phase, PhaseCallback callback) {
        String incidentId = run.getIncidentId();
        return Mono.defer(() -> {
            run.enterPhase(phase);
            structuredLogger.inContext(incidentId, phase,
                    () -> log.info("Processing phase {} for incident {}", phase.wireName(), incidentId));

            IncidentPhase nextPhase = run.nextPhase(phase);
            Runnable announcePhase = () -> broadcastFacade.incidentPhaseChanged(incidentId, phase, nextPhase,
                    run.completedPhases(), run.activeAgents(), run.progress(), 0.0);

            return tracker.track(run, phase, announcePhase,
                            () -> callback != null ? callback.execute(incident) : Mono.empty())
                    .then(Mono.fromRunnable(() -> {
                        double progress = run.completePhase(phase);
                        broadcastFacade.incidentPhaseChanged(incidentId, phase, nextPhase,
                                run.completedPhases(), run.activeAgents(), progress, 1.0);
                    }));
        });
    }

    private IncidentProcessingResult complete(IncidentRun run, Incident incident) {
        String incidentId = run.getIncidentId();
        List<IncidentPhase> completed = run.completedPhases();
        broadcastFacade.incidentPhaseChanged(incidentId, IncidentPhase.COMPLETE, null,
                completed, List.of(), 1.0, 1.0,
                "Incident " + incidentId + " resolved successfully", incident.getSeverity());

        double duration = run.elapsedSeconds();
        metrics.recordIncidentCompleted();
        structuredLogger.inContext(incidentId, null, () -> {
            structuredLogger.logIncidentCompleted(incidentId, duration, completed.size());
            log.info("Completed real-time processing for incident {} in {}s",
                    incidentId, String.format("%.2f", duration));
        });

        return IncidentProcessingResult.builder()
                .incidentId(incidentId)
                .status(IncidentProcessingResult.STATUS_COMPLETED)
                .durationSeconds(duration)
                .phasesCompleted(completed.size())
                .build();
    }

    private void fail(IncidentRun run, Throwable error) {
        String incidentId = run.getIncidentId();
        metrics.recordIncidentFailed();
        IncidentPhase phase = run.currentPhase();
        structuredLogger.inContext(incidentId, phase, () -> {
            structuredLogger.logIncidentFailed(incidentId, phase, error);
            log.error("Error processing incident {} in phase {}: {}", incidentId, phase, error.toString());
        });
        broadcastFacade.errorRaised(
                "incident_processing_error",
                "Failed to process incident " + incidentId + ": " + error.getMessage(),
                Severity.CRITICAL,
                ErrorContext.builder()
                        .incidentId(incidentId)
                        .phase(phase)
                        .recoverable(false)
                        .build());
    }

    private void release(IncidentRun run) {
        activeRuns.remove(run.getIncidentId(), run);
        broadcastFacade.incidentClosed(run.getIncidentId());
    }

    // ---------------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------------

    @Override
    public SystemHealthMetrics getSystemHealth() {
        int activeIncidents = activeRuns.size();
        double capacity = 1.0 - (double) activeIncidents / config.getMaxConcurrentIncidents();

        List<Double> samples = timings.allSamples();
        Collections.sort(samples);
        Map<String, Double> phaseAverages = new LinkedHashMap<>();
        timings.averageSeconds().forEach((phase, seconds) -> phaseAverages.put(phase.wireName(), seconds * 1000));

        int nominalAgents = config.getNominalAgentCount();
        int errorAgents = (int) Math.min(nominalAgents, broadcastFacade.agentStates().values().stream()
                .filter(AgentState::isFailure)
                .count());

        RegistryMetrics registryMetrics = connectionRegistry.metrics();

        return SystemHealthMetrics.builder()
                .activeAgents(nominalAgents)
                .healthyAgents(nominalAgents - errorAgents)
                .degradedAgents(0)
                .errorAgents(errorAgents)
                .currentIncidents(activeIncidents)
                .queueDepth(broadcastFacade.pendingMessages())
                .processingCapacity(Math.max(0.0, Math.min(1.0, capacity)))
                .averageLatencyMs(mean(samples) * 1000)
                .p95LatencyMs(percentile(samples, 0.95) * 1000)
                .p99LatencyMs(percentile(samples, 0.99) * 1000)
                .phaseAverageMs(phaseAverages)
                .websocketConnections(registryMetrics.getActiveConnections())
                .websocketLatencyMs(connectionRegistry.averageLatencyMs())
                .messagesPerSecond(registryMetrics.getMessagesPerSecond())
                .build();
    }

    @Override
    public void broadcastSystemHealth() {
        broadcastFacade.systemHealthSnapshot(getSystemHealth());
    }

    @Override
    public Set<String> activeIncidentIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    private static double mean(List<Double> sorted) {
        return sorted.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    // Nearest-rank percentile over an ascending list
    private static double percentile(List<Double> sorted, double quantile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int rank = (int) Math.ceil(quantile * sorted.size());
        return sorted.get(Math.max(0, rank - 1));
    }
}
