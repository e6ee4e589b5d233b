package com.z254.commander.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.commander.domain.model.IncidentPhase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructuredLoggerTest {

    private final StructuredLogger logger = new StructuredLogger(new ObjectMapper().findAndRegisterModules());

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("should expose incident and phase only for the duration of the action")
    void scopedContext() {
        AtomicReference<Map<String, String>> inside = new AtomicReference<>();

        logger.inContext("inc-1", IncidentPhase.PREDICTION, () -> inside.set(MDC.getCopyOfContextMap()));

        assertThat(inside.get())
                .containsEntry(StructuredLogger.MDC_INCIDENT_ID, "inc-1")
                .containsEntry(StructuredLogger.MDC_PHASE, "prediction")
                .containsEntry(StructuredLogger.MDC_AGENT_NAME, "prediction_agent");
        assertThat(MDC.get(StructuredLogger.MDC_INCIDENT_ID)).isNull();
        assertThat(MDC.get(StructuredLogger.MDC_PHASE)).isNull();
    }

    @Test
    @DisplayName("should restore the caller's MDC even when the action throws")
    void restoresOuterContext() {
        MDC.put("requestId", "req-7");
        MDC.put(StructuredLogger.MDC_INCIDENT_ID, "outer");

        assertThatThrownBy(() -> logger.inContext("inc-2", null, () -> {
            assertThat(MDC.get(StructuredLogger.MDC_INCIDENT_ID)).isEqualTo("inc-2");
            assertThat(MDC.get(StructuredLogger.MDC_PHASE)).isNull();
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(MDC.get("requestId")).isEqualTo("req-7");
        assertThat(MDC.get(StructuredLogger.MDC_INCIDENT_ID)).isEqualTo("outer");
    }
}
