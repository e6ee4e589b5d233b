package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * State change of one agent working on one incident phase.
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentUpdate implements DashboardPayload {

    @Builder.Default
    private final String updateId = UUID.randomUUID().toString();

    private final String agentName;

    /**
     * Agent type (detection, diagnosis, prediction, resolution, verification).
     */
    private final String agentType;

    private final String incidentId;
    private final AgentState state;
    private final IncidentPhase phase;

    /**
     * Progress of this agent's work, 0.0 to 1.0.
     */
    private final double progress;

    private final String currentTask;

    /**
     * Agent confidence, 0.0 to 1.0, when the agent reports one.
     */
    private final Double confidence;

    private final Long processingTimeMs;

    private final int evidenceCount;
    private final String keyFinding;

    @Builder.Default
    private final Instant timestamp = Instant.now();

    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    @Override
    public String messageType() {
        return MessageType.AGENT_UPDATE.wireName();
    }
}
