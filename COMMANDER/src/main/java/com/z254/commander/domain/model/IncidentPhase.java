package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Ordered stages an incident moves through.
 */
public enum IncidentPhase {
    DETECTION,
    DIAGNOSIS,
    PREDICTION,
    RESOLUTION,
    VERIFICATION,
    COMPLETE;

    private static final List<IncidentPhase> REQUIRED =
            List.of(DETECTION, DIAGNOSIS, PREDICTION, RESOLUTION);

    /**
     * Phases every incident must pass, in execution order.
     */
    public static List<IncidentPhase> requiredPhases() {
        return REQUIRED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Agent type responsible for this phase, e.g. {@code diagnosis}.
     */
    public String agentType() {
        return wireName();
    }

    public String agentName() {
        return wireName() + "_agent";
    }
}
