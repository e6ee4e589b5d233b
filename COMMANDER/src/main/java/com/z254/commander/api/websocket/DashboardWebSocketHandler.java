package com.z254.commander.api.websocket;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.commander.broadcast.BroadcastFacade;
import com.z254.commander.broadcast.ConnectionRegistry;
import com.z254.commander.config.CommanderProperties;
import com.z254.commander.domain.model.DashboardMessage;
import com.z254.commander.domain.model.Pong;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * WebSocket endpoint for operations dashboards.
 * Streams broadcast traffic to the client and answers pings.
 */
@Component
@Slf4j
public class DashboardWebSocketHandler implements WebSocketHandler {

    public static final String PATH = "/dashboard/ws";

    private final ConnectionRegistry registry;
    private final BroadcastFacade broadcastFacade;
    private final ObjectMapper objectMapper;
    private final int transportBufferSize;

    public DashboardWebSocketHandler(ConnectionRegistry registry,
                                     BroadcastFacade broadcastFacade,
                                     ObjectMapper objectMapper,
                                     CommanderProperties properties) {
        this.registry = registry;
        this.broadcastFacade = broadcastFacade;
        this.objectMapper = objectMapper;
        this.transportBufferSize = properties.getBroadcast().getTransportBufferSize();
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = session.getId();
        WebSocketSessionTransport transport = new WebSocketSessionTransport(session, transportBufferSize);

        return registry.connect(connectionId, transport, broadcastFacade.initialState())
                .flatMap(accepted -> accepted
                        ? stream(session, connectionId, transport)
                        : Mono.empty());
    }

    private Mono<Void> stream(WebSocketSession session, String connectionId, WebSocketSessionTransport transport) {
        // Handle incoming messages
        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(payload -> log.debug("Received from {}: {}", connectionId, payload))
                .concatMap(payload -> handleClientMessage(connectionId, payload))
                .then();

        // Send outgoing messages
        Mono<Void> output = session.send(transport.outbound().map(session::textMessage));

        // Whichever side finishes first ends the session
        return output.or(input)
                .doFinally(signalType -> {
                    log.info("Dashboard session ended: {} - {}", connectionId, signalType);
                    registry.disconnect(connectionId).subscribe();
                });
    }

    Mono<Void> handleClientMessage(String connectionId, String payload) {
        registry.recordClientMessage(connectionId);
        try {
            ClientCommand command = objectMapper.readValue(payload, ClientCommand.class);
            String action = command.getAction();
            if (action == null) {
                log.warn("Message without action from {}", connectionId);
                return Mono.empty();
            }
            return switch (action) {
                case "ping" -> handlePing(connectionId, command);
                default -> {
                    log.warn("Unknown action from {}: {}", connectionId, action);
                    yield Mono.empty();
                }
            };
        } catch (JsonProcessingException e) {
            log.warn("Invalid JSON from {}: {}", connectionId, e.getOriginalMessage());
            return Mono.empty();
        }
    }

    private Mono<Void> handlePing(String connectionId, ClientCommand command) {
        Long latencyMs = null;
        if (command.getTimestamp() != null) {
            latencyMs = Math.max(0L, Duration.between(command.getTimestamp(), Instant.now()).toMillis());
        }
        registry.recordPing(connectionId, latencyMs);
        Pong pong = Pong.builder().latencyMs(latencyMs).build();
        return registry.sendOne(connectionId, DashboardMessage.of(pong, DashboardMessage.PRIORITY_HIGH))
                .then();
    }

    /**
     * Inbound client message.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ClientCommand {
        private String action;

        /**
         * Client send time, either ISO-8601 or epoch milliseconds.
         */
        @JsonFormat(without = JsonFormat.Feature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS)
        private Instant timestamp;
    }
}
