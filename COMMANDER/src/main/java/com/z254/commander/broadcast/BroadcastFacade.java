package com.z254.commander.broadcast;

import com.z254.commander.domain.model.AgentState;
import com.z254.commander.domain.model.AgentUpdate;
import com.z254.commander.domain.model.DashboardMessage;
import com.z254.commander.domain.model.ErrorContext;
import com.z254.commander.domain.model.ErrorNotification;
import com.z254.commander.domain.model.IncidentFlowUpdate;
import com.z254.commander.domain.model.IncidentPhase;
import com.z254.commander.domain.model.InitialState;
import com.z254.commander.domain.model.OpaquePayload;
import com.z254.commander.domain.model.Severity;
import com.z254.commander.domain.model.SystemHealthMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Typed entry points for producers of dashboard traffic.
 * <p>
 * Each call builds one {@link DashboardMessage} and hands it to the {@link BatchScheduler}.
 * The facade also remembers the latest agent states and incident flows so that newly
 * connected dashboards can be sent an {@link InitialState}.
 */
@Slf4j
@Component
public class BroadcastFacade {

    private final BatchScheduler scheduler;

    private final Map<String, AgentState> agentStates = new ConcurrentHashMap<>();
    private final Map<String, IncidentFlowUpdate> incidentFlows = new ConcurrentHashMap<>();

    public BroadcastFacade(BatchScheduler scheduler) {
        this.scheduler = scheduler;
    }

    // ---------------------------------------------------------------------
    // Producer API
    // ---------------------------------------------------------------------

    public void agentStateChanged(String incidentId, String agentName, String agentType,
                                  AgentState state, IncidentPhase phase, double progress,
                                  Double confidence, Long durationMs) {
        agentStates.put(agentName, state);

        AgentUpdate update = AgentUpdate.builder()
                .incidentId(incidentId)
                .agentName(agentName)
                .agentType(agentType)
                .state(state)
                .phase(phase)
                .progress(progress)
                .confidence(confidence)
                .processingTimeMs(durationMs)
                .build();

        int priority = state == AgentState.ERROR
                ? DashboardMessage.PRIORITY_MEDIUM
                : DashboardMessage.PRIORITY_LOW;
        scheduler.enqueue(DashboardMessage.of(update, priority));
        log.debug("Queued agent update: {} -> {}", agentName, state.wireName());
    }

    public void incidentPhaseChanged(String incidentId, IncidentPhase phase, IncidentPhase nextPhase,
                                     List<IncidentPhase> completedPhases, List<String> activeAgents,
                                     double overallProgress, double phaseProgress) {
        incidentPhaseChanged(incidentId, phase, nextPhase, completedPhases, activeAgents,
                overallProgress, phaseProgress, null, null);
    }

    /**
     * @param nextPhase phase the incident moves to next, {@code null} once complete
     */
    public void incidentPhaseChanged(String incidentId, IncidentPhase phase, IncidentPhase nextPhase,
                                     List<IncidentPhase> completedPhases, List<String> activeAgents,
                                     double overallProgress, double phaseProgress,
                                     String incidentSummary, Severity severity) {
        List<IncidentPhase> completed = List.copyOf(completedPhases);
        List<String> completedAgents = new ArrayList<>(completed.size());
        completed.forEach(p -> completedAgents.add(p.agentName()));

        IncidentFlowUpdate update = IncidentFlowUpdate.builder()
                .incidentId(incidentId)
                .currentPhase(phase)
                .completedPhases(completed)
                .nextPhase(nextPhase)
                .overallProgress(overallProgress)
                .phaseProgress(phaseProgress)
                .activeAgents(List.copyOf(activeAgents))
                .completedAgents(List.copyOf(completedAgents))
                .incidentSummary(incidentSummary)
                .severity(severity)
                .build();

        if (phase == IncidentPhase.COMPLETE) {
            incidentFlows.remove(incidentId);
        } else {
            incidentFlows.put(incidentId, update);
        }

        scheduler.enqueue(DashboardMessage.of(update, DashboardMessage.PRIORITY_MEDIUM));
        log.debug("Queued incident flow: {} -> {}", incidentId, phase.wireName());
    }

    public void systemHealthSnapshot(SystemHealthMetrics metrics) {
        scheduler.enqueue(DashboardMessage.of(metrics, DashboardMessage.PRIORITY_LOW));
    }

    public void errorRaised(String errorType, String errorMessage, Severity severity, ErrorContext context) {
        ErrorContext ctx = context != null ? context : ErrorContext.none();
        ErrorNotification notification = ErrorNotification.builder()
                .errorType(errorType)
                .errorMessage(errorMessage)
                .severity(severity)
                .incidentId(ctx.getIncidentId())
                .agentName(ctx.getAgentName())
                .phase(ctx.getPhase())
                .recoveryAction(ctx.getRecoveryAction())
                .retryCount(ctx.getRetryCount())
                .recoverable(ctx.isRecoverable())
                .stackTrace(ctx.getStackTrace())
                .build();

        int priority = severity.isUrgent()
                ? DashboardMessage.PRIORITY_HIGH
                : DashboardMessage.PRIORITY_MEDIUM;
        scheduler.enqueue(DashboardMessage.of(notification, priority));
        log.warn("Queued error notification: {} - {}", errorType, errorMessage);
    }

    /**
     * Forwards a message kind this service does not model, e.g. {@code 3d_scene_update}.
     */
    public void opaque(String type, Map<String, Object> data, int priority) {
        scheduler.enqueue(DashboardMessage.of(new OpaquePayload(type, data), priority));
    }

    // ---------------------------------------------------------------------
    // Dashboard state
    // ---------------------------------------------------------------------

    /**
     * Forgets the tracked flow of an incident that is no longer being processed.
     */
    public void incidentClosed(String incidentId) {
        incidentFlows.remove(incidentId);
    }

    public DashboardMessage initialState() {
        InitialState state = InitialState.builder()
                .agentStates(Map.copyOf(agentStates))
                .activeIncidents(List.copyOf(incidentFlows.values()))
                .build();
        return DashboardMessage.of(state, DashboardMessage.PRIORITY_HIGH);
    }

    public Map<String, AgentState> agentStates() {
        return Map.copyOf(agentStates);
    }

    public int pendingMessages() {
        return scheduler.pendingCount();
    }
}
