package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable unit of outbound dashboard traffic.
 */
@Getter
@ToString
public final class DashboardMessage {

    public static final int PRIORITY_LOW = 1;
    public static final int PRIORITY_MEDIUM = 2;
    public static final int PRIORITY_HIGH = 3;

    private final String messageId;
    private final String type;
    private final Instant timestamp;

    /**
     * Batch ordering hint, 1 (low) to 3 (high). Never preempts an in-flight write.
     */
    private final int priority;

    @JsonProperty("data")
    private final DashboardPayload payload;

    private DashboardMessage(DashboardPayload payload, int priority, Instant timestamp) {
        this.payload = Objects.requireNonNull(payload, "payload");
        this.type = payload.messageType();
        this.priority = priority;
        this.timestamp = timestamp;
        this.messageId = UUID.randomUUID().toString();
    }

    public static DashboardMessage of(DashboardPayload payload, int priority) {
        if (priority < PRIORITY_LOW || priority > PRIORITY_HIGH) {
            throw new IllegalArgumentException("Priority must be between 1 and 3: " + priority);
        }
        return new DashboardMessage(payload, priority, Instant.now());
    }
}
