package com.z254.commander.orchestration;

import com.z254.commander.broadcast.BroadcastFacade;
import com.z254.commander.domain.model.AgentState;
import com.z254.commander.domain.model.ErrorContext;
import com.z254.commander.domain.model.IncidentPhase;
import com.z254.commander.domain.model.Severity;
import com.z254.commander.observability.CommanderMetrics;
import com.z254.commander.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Wraps one agent invocation and broadcasts its state transitions:
 * initializing, processing, then completed, timeout or error.
 * <p>
 * The agent is listed as active for the incident from entry until the invocation
 * terminates or is cancelled, whichever way it ends.
 */
@Slf4j
class AgentExecutionTracker {

    private final BroadcastFacade broadcastFacade;
    private final CommanderMetrics metrics;
    private final StructuredLogger structuredLogger;
    private final PhaseTimings timings;
    private final Duration phaseTimeout;

    AgentExecutionTracker(BroadcastFacade broadcastFacade,
                          CommanderMetrics metrics,
                          StructuredLogger structuredLogger,
                          PhaseTimings timings,
                          Duration phaseTimeout) {
        this.broadcastFacade = broadcastFacade;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.timings = timings;
        this.phaseTimeout = phaseTimeout;
    }

    /**
     * @param onEntered runs once the agent is registered as active, before any agent broadcast
     * @param work      the agent invocation, subscribed once
     */
    Mono<Object> track(IncidentRun run, IncidentPhase phase, Runnable onEntered, Supplier<Mono<?>> work) {
        String incidentId = run.getIncidentId();
        String agentName = phase.agentName();

        return Mono.defer(() -> {
            long start = System.nanoTime();
            AtomicBoolean settled = new AtomicBoolean();

            run.agentStarted(agentName);
            onEntered.run();
            broadcast(run, phase, AgentState.INITIALIZING, 0.0, null);
            broadcast(run, phase, AgentState.PROCESSING, 0.5, null);

            Mono<Object> invocation = Mono.<Object>defer(work);
            if (hasTimeout()) {
                invocation = invocation.timeout(phaseTimeout);
            }

            return invocation
                    .doOnSuccess(result -> structuredLogger.inContext(incidentId, phase, () -> {
                        settle(run, agentName, settled);
                        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                        broadcast(run, phase, AgentState.COMPLETED, 1.0, elapsedMs);
                        timings.record(phase, elapsedMs / 1000.0);
                        metrics.recordPhaseDuration(phase, Duration.ofMillis(elapsedMs));
                        structuredLogger.logPhaseCompleted(incidentId, phase, elapsedMs);
                    }))
                    .doOnError(error -> structuredLogger.inContext(incidentId, phase, () -> {
                        settle(run, agentName, settled);
                        if (error instanceof TimeoutException) {
                            onTimeout(run, phase);
                        } else {
                            onFailure(run, phase, error);
                        }
                    }))
                    .doOnCancel(() -> structuredLogger.inContext(incidentId, phase, () -> {
                        if (settle(run, agentName, settled)) {
                            log.warn("Agent {} cancelled in phase {} for incident {}",
                                    agentName, phase.wireName(), incidentId);
                            broadcast(run, phase, AgentState.ERROR, 0.5, null);
                        }
                    }));
        });
    }

    private boolean hasTimeout() {
        return phaseTimeout != null && !phaseTimeout.isZero() && !phaseTimeout.isNegative();
    }

    /**
     * Removes the agent from the active set exactly once.
     *
     * @return {@code true} for the call that performed the removal
     */
    private boolean settle(IncidentRun run, String agentName, AtomicBoolean settled) {
        if (settled.compareAndSet(false, true)) {
            run.agentFinished(agentName);
            return true;
        }
        return false;
    }

    private void onTimeout(IncidentRun run, IncidentPhase phase) {
        String agentName = phase.agentName();
        log.warn("Agent {} timed out after {} in phase {} for incident {}",
                agentName, phaseTimeout, phase.wireName(), run.getIncidentId());
        metrics.recordPhaseTimeout();
        broadcast(run, phase, AgentState.TIMEOUT, 0.5, null);
        broadcastFacade.errorRaised(
                "agent_timeout",
                "Agent " + agentName + " timed out in phase " + phase.wireName(),
                Severity.HIGH,
                ErrorContext.builder()
                        .incidentId(run.getIncidentId())
                        .agentName(agentName)
                        .phase(phase)
                        .build());
    }

    private void onFailure(IncidentRun run, IncidentPhase phase, Throwable error) {
        String agentName = phase.agentName();
        log.warn("Agent {} failed in phase {} for incident {}: {}",
                agentName, phase.wireName(), run.getIncidentId(), error.toString());
        broadcast(run, phase, AgentState.ERROR, 0.5, null);
        broadcastFacade.errorRaised(
                "agent_execution_error",
                "Agent " + agentName + " failed: " + error.getMessage(),
                Severity.HIGH,
                ErrorContext.builder()
                        .incidentId(run.getIncidentId())
                        .agentName(agentName)
                        .phase(phase)
                        .stackTrace(error.toString())
                        .build());
    }

    private void broadcast(IncidentRun run, IncidentPhase phase, AgentState state, double progress, Long durationMs) {
        broadcastFacade.agentStateChanged(run.getIncidentId(), phase.agentName(), phase.agentType(),
                state, phase, progress, null, durationMs);
    }
}
