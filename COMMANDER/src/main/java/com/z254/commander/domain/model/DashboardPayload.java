package com.z254.commander.domain.model;

/**
 * Typed content of a {@link DashboardMessage}.
 * <p>
 * Each implementation maps to exactly one wire type tag. {@link OpaquePayload} carries
 * its own tag for message kinds this service only forwards.
 */
public interface DashboardPayload {

    /**
     * Wire type tag, e.g. {@code agent_update}.
     */
    String messageType();
}
