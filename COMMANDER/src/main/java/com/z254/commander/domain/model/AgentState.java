package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of an agent as shown on the dashboard.
 */
public enum AgentState {
    IDLE,
    INITIALIZING,
    ANALYZING,
    PROCESSING,
    WAITING,
    COMPLETED,
    ERROR,
    TIMEOUT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isFailure() {
        return this == ERROR || this == TIMEOUT;
    }
}
