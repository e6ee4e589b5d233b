package com.z254.commander.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.commander.domain.model.IncidentPhase;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for COMMANDER.
 * Provides consistent, machine-parseable log entries for incident processing.
 */
@Component
@Slf4j
public class StructuredLogger {

    private final ObjectMapper objectMapper;

    // MDC keys for context
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_PHASE = "phase";
    public static final String MDC_AGENT_NAME = "agentName";

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Run an action with the incident (and, when given, phase and agent) in MDC.
     * The previous MDC content is restored afterwards.
     */
    public void inContext(String incidentId, IncidentPhase phase, Runnable action) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        try {
            if (incidentId != null) MDC.put(MDC_INCIDENT_ID, incidentId);
            if (phase != null) {
                MDC.put(MDC_PHASE, phase.wireName());
                MDC.put(MDC_AGENT_NAME, phase.agentName());
            }
            action.run();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    public void logIncidentStarted(String incidentId, int totalPhases) {
        logEvent("incident_started", Map.of(
                "incidentId", incidentId,
                "totalPhases", totalPhases
        ));
    }

    public void logIncidentCompleted(String incidentId, double durationSeconds, int phasesCompleted) {
        logEvent("incident_completed", Map.of(
                "incidentId", incidentId,
                "durationSeconds", durationSeconds,
                "phasesCompleted", phasesCompleted
        ));
    }

    public void logIncidentFailed(String incidentId, IncidentPhase phase, Throwable error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("incidentId", incidentId);
        data.put("phase", phase != null ? phase.wireName() : "unknown");
        data.put("errorType", error.getClass().getSimpleName());
        data.put("error", String.valueOf(error.getMessage()));
        logEvent("incident_failed", data);
    }

    public void logPhaseCompleted(String incidentId, IncidentPhase phase, long durationMs) {
        logEvent("phase_completed", Map.of(
                "incidentId", incidentId,
                "phase", phase.wireName(),
                "durationMs", durationMs
        ));
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("event", eventType);
            event.put("timestamp", Instant.now().toString());
            event.putAll(data);
            log.info("event={} {}", eventType, objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize log event {}: {}", eventType, e.getMessage());
        }
    }
}
