package com.z254.commander.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Snapshot sent to a dashboard right after it connects.
 */
@Getter
@Builder
@ToString
public class InitialState implements DashboardPayload {

    public static final String STATUS_OPERATIONAL = "operational";

    @Builder.Default
    private final Map<String, AgentState> agentStates = Map.of();

    @Builder.Default
    private final List<IncidentFlowUpdate> activeIncidents = List.of();

    @Builder.Default
    private final String systemStatus = STATUS_OPERATIONAL;

    @Override
    public String messageType() {
        return MessageType.INITIAL_STATE.wireName();
    }
}
