package com.z254.commander.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Point-in-time health of the orchestrator and the broadcast layer.
 */
@Getter
@Builder
@ToString
public class SystemHealthMetrics implements DashboardPayload {

    @Builder.Default
    private final String healthId = UUID.randomUUID().toString();

    @Builder.Default
    private final Instant timestamp = Instant.now();

    // Agent health
    private final int activeAgents;
    private final int healthyAgents;
    private final int degradedAgents;
    private final int errorAgents;

    // Processing
    private final int currentIncidents;
    private final int queueDepth;

    /**
     * Remaining share of incident capacity, 0.0 to 1.0.
     */
    private final double processingCapacity;

    // Phase latency
    private final double averageLatencyMs;
    private final double p95LatencyMs;
    private final double p99LatencyMs;

    /**
     * Average duration per phase, keyed by phase wire name.
     */
    @Builder.Default
    private final Map<String, Double> phaseAverageMs = Map.of();

    // Broadcast layer
    private final int websocketConnections;
    private final double websocketLatencyMs;
    private final double messagesPerSecond;

    @Override
    public String messageType() {
        return MessageType.SYSTEM_HEALTH.wireName();
    }
}
