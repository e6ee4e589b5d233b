package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Progress of an incident through the phase sequence.
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IncidentFlowUpdate implements DashboardPayload {

    private final String incidentId;

    @Builder.Default
    private final String flowUpdateId = UUID.randomUUID().toString();

    @Builder.Default
    private final Instant timestamp = Instant.now();

    private final IncidentPhase currentPhase;

    @Builder.Default
    private final List<IncidentPhase> completedPhases = List.of();

    private final IncidentPhase nextPhase;

    private final double overallProgress;
    private final double phaseProgress;
    private final Integer estimatedCompletionSeconds;

    @Builder.Default
    private final List<String> activeAgents = List.of();

    @Builder.Default
    private final List<String> completedAgents = List.of();

    private final String incidentSummary;
    private final Severity severity;

    @Override
    public String messageType() {
        return MessageType.INCIDENT_FLOW.wireName();
    }
}
