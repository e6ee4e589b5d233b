package com.z254.commander.broadcast;

import reactor.core.publisher.Mono;

/**
 * Write side of one dashboard connection.
 * <p>
 * {@link #send(String)} may fail; the registry treats any failure as fatal for the
 * connection. {@link #close(int, String)} must be safe to call more than once.
 */
public interface DashboardTransport {

    int CLOSE_NORMAL = 1000;
    int CLOSE_POLICY_VIOLATION = 1008;
    int CLOSE_OVERLOADED = 1013;

    Mono<Void> send(String payload);

    Mono<Void> close(int code, String reason);

    default Mono<Void> close() {
        return close(CLOSE_NORMAL, "Connection closed");
    }
}
