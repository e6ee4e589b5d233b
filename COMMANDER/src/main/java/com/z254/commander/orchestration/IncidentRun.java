package com.z254.commander.orchestration;

import com.z254.commander.domain.model.IncidentPhase;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Bookkeeping for one incident while the orchestrator processes it.
 * <p>
 * Completed phases are unique and in phase order; progress never decreases.
 */
public class IncidentRun {

    @Getter
    private final String incidentId;
    @Getter
    private final Instant startedAt = Instant.now();
    @Getter
    private final List<IncidentPhase> phases;

    private final long startNanos = System.nanoTime();
    private final List<IncidentPhase> completedPhases = new ArrayList<>();
    private final Set<String> activeAgents = new LinkedHashSet<>();
    private IncidentPhase currentPhase;
    private double progress;

    public IncidentRun(String incidentId, List<IncidentPhase> phases) {
        if (phases.isEmpty()) {
            throw new IllegalArgumentException("An incident run needs at least one phase");
        }
        this.incidentId = incidentId;
        this.phases = List.copyOf(phases);
    }

    public int getTotalPhases() {
        return phases.size();
    }

    /**
     * Phase this run executes after the given one: {@link IncidentPhase#COMPLETE} after the
     * last planned phase, {@code null} after {@code COMPLETE}.
     */
    public IncidentPhase nextPhase(IncidentPhase phase) {
        if (phase == IncidentPhase.COMPLETE) {
            return null;
        }
        int index = phases.indexOf(phase);
        return index >= 0 && index + 1 < phases.size() ? phases.get(index + 1) : IncidentPhase.COMPLETE;
    }

    synchronized void enterPhase(IncidentPhase phase) {
        this.currentPhase = phase;
    }

    synchronized void agentStarted(String agentName) {
        activeAgents.add(agentName);
    }

    synchronized void agentFinished(String agentName) {
        activeAgents.remove(agentName);
    }

    /**
     * Records a finished phase and recomputes progress.
     *
     * @return the new overall progress
     */
    synchronized double completePhase(IncidentPhase phase) {
        if (!completedPhases.isEmpty()) {
            IncidentPhase last = completedPhases.get(completedPhases.size() - 1);
            if (phase.ordinal() <= last.ordinal()) {
                throw new IllegalStateException(
                        "Phase " + phase + " completed out of order after " + last + " for " + incidentId);
            }
        }
        completedPhases.add(phase);
        progress = Math.max(progress, Math.min(1.0, (double) completedPhases.size() / phases.size()));
        return progress;
    }

    public synchronized List<IncidentPhase> completedPhases() {
        return List.copyOf(completedPhases);
    }

    public synchronized List<String> activeAgents() {
        return new ArrayList<>(activeAgents);
    }

    public synchronized IncidentPhase currentPhase() {
        return currentPhase;
    }

    public synchronized double progress() {
        return progress;
    }

    public double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
