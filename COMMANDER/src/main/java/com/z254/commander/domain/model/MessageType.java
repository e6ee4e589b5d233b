package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wire type tags of the messages pushed to dashboards.
 */
public enum MessageType {
    AGENT_UPDATE("agent_update"),
    INCIDENT_FLOW("incident_flow"),
    SYSTEM_HEALTH("system_health"),
    ERROR_NOTIFICATION("error_notification"),
    INITIAL_STATE("initial_state"),
    PONG("pong");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
