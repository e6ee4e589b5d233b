package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Failure surfaced to dashboard operators.
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorNotification implements DashboardPayload {

    @Builder.Default
    private final String errorId = UUID.randomUUID().toString();

    @Builder.Default
    private final Instant timestamp = Instant.now();

    private final String errorType;
    private final String errorMessage;
    private final Severity severity;

    // Context
    private final String incidentId;
    private final String agentName;
    private final IncidentPhase phase;

    // Recovery
    private final String recoveryAction;
    private final int retryCount;

    @Builder.Default
    private final boolean recoverable = true;

    private final String stackTrace;

    @Override
    public String messageType() {
        return MessageType.ERROR_NOTIFICATION.wireName();
    }
}
