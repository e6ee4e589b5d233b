package com.z254.commander.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Pong implements DashboardPayload {

    @Builder.Default
    private final Instant serverTime = Instant.now();

    /**
     * Client-to-server latency derived from the ping timestamp, when the client sent one.
     */
    private final Long latencyMs;

    @Override
    public String messageType() {
        return MessageType.PONG.wireName();
    }
}
