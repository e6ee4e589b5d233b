package com.z254.commander.domain.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Optional context attached to an {@link ErrorNotification}.
 */
@Getter
@Builder
public class ErrorContext {

    private static final ErrorContext NONE = ErrorContext.builder().build();

    private final String incidentId;
    private final String agentName;
    private final IncidentPhase phase;
    private final String recoveryAction;
    private final int retryCount;

    @Builder.Default
    private final boolean recoverable = true;

    private final String stackTrace;

    public static ErrorContext none() {
        return NONE;
    }
}
