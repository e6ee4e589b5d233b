package com.z254.commander.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.commander.domain.model.AgentState;
import com.z254.commander.domain.model.AgentUpdate;
import com.z254.commander.domain.model.DashboardMessage;
import com.z254.commander.domain.model.IncidentPhase;
import com.z254.commander.domain.model.OpaquePayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DashboardMessageCodec}.
 */
class DashboardMessageCodecTest {

    private final ObjectMapper reader = new ObjectMapper();
    private DashboardMessageCodec codec;

    @BeforeEach
    void setUp() {
        codec = new DashboardMessageCodec(new ObjectMapper().findAndRegisterModules());
    }

    @Test
    @DisplayName("should write the snake_case envelope with lower-case enum values")
    void encodesEnvelope() throws Exception {
        AgentUpdate update = AgentUpdate.builder()
                .incidentId("inc-1")
                .agentName("diagnosis_agent")
                .agentType("diagnosis")
                .state(AgentState.COMPLETED)
                .phase(IncidentPhase.DIAGNOSIS)
                .progress(1.0)
                .processingTimeMs(250L)
                .build();

        JsonNode json = reader.readTree(codec.encode(DashboardMessage.of(update, 1)).orElseThrow());

        assertThat(json.get("type").asText()).isEqualTo("agent_update");
        assertThat(json.get("priority").asInt()).isEqualTo(1);
        assertThat(json.has("message_id")).isTrue();
        assertThat(json.get("timestamp").isTextual()).isTrue();

        JsonNode data = json.get("data");
        assertThat(data.get("agent_name").asText()).isEqualTo("diagnosis_agent");
        assertThat(data.get("state").asText()).isEqualTo("completed");
        assertThat(data.get("phase").asText()).isEqualTo("diagnosis");
        assertThat(data.get("processing_time_ms").asLong()).isEqualTo(250L);
        assertThat(data.has("confidence")).isFalse();
    }

    @Test
    @DisplayName("should write opaque content flat into data")
    void encodesOpaquePayload() throws Exception {
        DashboardMessage message = DashboardMessage.of(
                new OpaquePayload("3d_scene_update", Map.of("nodeCount", 12)), 1);

        JsonNode json = reader.readTree(codec.encode(message).orElseThrow());

        assertThat(json.get("type").asText()).isEqualTo("3d_scene_update");
        assertThat(json.get("data").get("nodeCount").asInt()).isEqualTo(12);
    }
}
