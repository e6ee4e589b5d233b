package com.z254.commander.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the COMMANDER service.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "commander")
public class CommanderProperties {

    @Valid
    private BroadcastProperties broadcast = new BroadcastProperties();
    @Valid
    private OrchestratorProperties orchestrator = new OrchestratorProperties();

    @Data
    public static class BroadcastProperties {
        /**
         * Maximum number of concurrently connected dashboard clients.
         */
        @Positive
        private int maxConnections = 1000;

        /**
         * Capacity of each connection's outbound queue. Oldest entries are evicted when full.
         */
        @Positive
        private int queueCapacity = 100;

        /**
         * Period of the batch scheduler tick.
         */
        @NotNull
        private Duration batchInterval = Duration.ofMillis(50);

        /**
         * Upper bound for a single transport write before the connection is dropped.
         */
        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(1);

        /**
         * Upper bound for the flush performed when the scheduler stops.
         */
        @NotNull
        private Duration finalFlushTimeout = Duration.ofSeconds(5);

        /**
         * Frames buffered by the WebSocket transport ahead of the socket.
         */
        @Positive
        private int transportBufferSize = 256;

        @NotNull
        private Duration healthBroadcastInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class OrchestratorProperties {
        /**
         * Timeout applied to every phase callback. Zero disables it.
         */
        @NotNull
        private Duration phaseTimeout = Duration.ofSeconds(30);

        @Positive
        private int maxConcurrentIncidents = 10;

        @Positive
        private int nominalAgentCount = 4;

        /**
         * Number of timing samples kept per phase for health reporting.
         */
        @Positive
        private int timingWindow = 100;
    }
}
