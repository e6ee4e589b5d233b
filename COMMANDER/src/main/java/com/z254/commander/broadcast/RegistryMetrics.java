package com.z254.commander.broadcast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate statistics of the connection registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistryMetrics {
    private int activeConnections;
    private int maxConnections;
    private long totalConnections;
    private long totalMessagesSent;

    /**
     * Messages evicted from full outbound queues.
     */
    private long droppedMessages;

    private long uptimeSeconds;
    private double messagesPerSecond;
}
