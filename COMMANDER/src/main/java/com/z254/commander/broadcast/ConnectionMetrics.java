package com.z254.commander.broadcast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-connection delivery statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionMetrics {
    private String connectionId;
    private Instant connectedAt;
    private long messagesSent;
    private long messagesReceived;
    private int queuedMessages;
    private Instant lastPing;
    private Long latencyMs;
}
