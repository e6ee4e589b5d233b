package com.z254.commander.api.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.commander.broadcast.BatchScheduler;
import com.z254.commander.broadcast.BroadcastFacade;
import com.z254.commander.broadcast.ConnectionMetrics;
import com.z254.commander.broadcast.ConnectionRegistry;
import com.z254.commander.broadcast.DashboardMessageCodec;
import com.z254.commander.broadcast.DashboardTransport;
import com.z254.commander.config.CommanderProperties;
import com.z254.commander.observability.CommanderMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link DashboardWebSocketHandler}.
 */
class DashboardWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private CommanderProperties properties;
    private ConnectionRegistry registry;
    private DashboardWebSocketHandler handler;

    private WebSocketSession session;
    private Sinks.Many<WebSocketMessage> inboundSink;
    private List<String> sentMessages;

    @BeforeEach
    void setUp() {
        properties = new CommanderProperties();
        build();

        sentMessages = new CopyOnWriteArrayList<>();
        inboundSink = Sinks.many().unicast().onBackpressureBuffer();
        session = mockSession("dash-1");
    }

    private void build() {
        BatchScheduler scheduler = mock(BatchScheduler.class);
        registry = new ConnectionRegistry(properties, new DashboardMessageCodec(objectMapper),
                new CommanderMetrics(new SimpleMeterRegistry()));
        handler = new DashboardWebSocketHandler(registry, new BroadcastFacade(scheduler), objectMapper, properties);
    }

    private WebSocketSession mockSession(String id) {
        WebSocketSession mocked = mock(WebSocketSession.class);
        when(mocked.getId()).thenReturn(id);
        when(mocked.receive()).thenAnswer(inv -> inboundSink.asFlux());
        when(mocked.textMessage(anyString())).thenAnswer(inv -> {
            WebSocketMessage message = mock(WebSocketMessage.class);
            when(message.getPayloadAsText()).thenReturn(inv.getArgument(0));
            return message;
        });
        when(mocked.send(any())).thenAnswer(inv -> {
            Publisher<WebSocketMessage> frames = inv.getArgument(0);
            return Flux.from(frames)
                    .doOnNext(frame -> sentMessages.add(frame.getPayloadAsText()))
                    .then();
        });
        when(mocked.close(any(CloseStatus.class))).thenReturn(Mono.empty());
        return mocked;
    }

    private WebSocketMessage inbound(String payload) {
        WebSocketMessage message = mock(WebSocketMessage.class);
        when(message.getPayloadAsText()).thenReturn(payload);
        return message;
    }

    private List<String> sentTypes() {
        return sentMessages.stream()
                .map(text -> {
                    try {
                        return objectMapper.readTree(text).get("type").asText();
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                })
                .toList();
    }

    @Nested
    @DisplayName("Connection Handling")
    class ConnectionHandlingTests {

        @Test
        @DisplayName("should register the session and send the initial state first")
        void sendsInitialState() {
            handler.handle(session).subscribe();

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(sentTypes()).containsExactly("initial_state"));
            assertThat(registry.isConnected("dash-1")).isTrue();
        }

        @Test
        @DisplayName("should unregister the session when the client goes away")
        void disconnectsWhenInputEnds() {
            handler.handle(session).subscribe();
            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(registry.isConnected("dash-1")).isTrue());

            inboundSink.tryEmitComplete();

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(registry.isConnected("dash-1")).isFalse());
            verify(session).close(argThat(status -> status.getCode() == DashboardTransport.CLOSE_NORMAL));
        }

        @Test
        @DisplayName("should close an over-limit session as overloaded without streaming")
        void rejectsWhenFull() {
            properties.getBroadcast().setMaxConnections(1);
            build();
            registry.connect("existing", mock(DashboardTransport.class), null).block(Duration.ofSeconds(1));

            StepVerifier.create(handler.handle(session))
                    .verifyComplete();

            verify(session).close(argThat(status -> status.getCode() == DashboardTransport.CLOSE_OVERLOADED
                    && "Server overloaded".equals(status.getReason())));
            verify(session, never()).send(any());
            assertThat(registry.isConnected("dash-1")).isFalse();
        }
    }

    @Nested
    @DisplayName("Message Handling")
    class MessageHandlingTests {

        @Test
        @DisplayName("should answer a ping with a pong carrying the latency")
        void respondsToPing() throws Exception {
            handler.handle(session).subscribe();
            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(registry.isConnected("dash-1")).isTrue());

            long sentAt = System.currentTimeMillis() - 25;
            inboundSink.tryEmitNext(inbound("{\"action\":\"ping\",\"timestamp\":" + sentAt + "}"));

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(sentTypes()).containsExactly("initial_state", "pong"));

            JsonNode pong = readLast();
            assertThat(pong.get("priority").asInt()).isEqualTo(3);
            assertThat(pong.get("data").get("latency_ms").asLong()).isGreaterThanOrEqualTo(25L);

            ConnectionMetrics metrics = registry.connectionMetrics("dash-1").orElseThrow();
            assertThat(metrics.getMessagesReceived()).isEqualTo(1);
            assertThat(metrics.getLastPing()).isNotNull();
            assertThat(metrics.getLatencyMs()).isGreaterThanOrEqualTo(25L);
        }

        @Test
        @DisplayName("should answer a ping whose timestamp is an ISO-8601 string")
        void respondsToIsoPing() throws Exception {
            handler.handle(session).subscribe();
            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(registry.isConnected("dash-1")).isTrue());

            String sentAt = Instant.now().minusMillis(25).toString();
            inboundSink.tryEmitNext(inbound("{\"action\":\"ping\",\"timestamp\":\"" + sentAt + "\"}"));

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(sentTypes()).containsExactly("initial_state", "pong"));

            assertThat(readLast().get("data").get("latency_ms").asLong()).isGreaterThanOrEqualTo(25L);
            ConnectionMetrics metrics = registry.connectionMetrics("dash-1").orElseThrow();
            assertThat(metrics.getLastPing()).isNotNull();
            assertThat(metrics.getLatencyMs()).isGreaterThanOrEqualTo(25L);
        }

        @Test
        @DisplayName("should ignore unknown actions and invalid JSON")
        void ignoresUnknownInput() {
            registry.connect("dash-1", mock(DashboardTransport.class), null).block(Duration.ofSeconds(1));

            StepVerifier.create(handler.handleClientMessage("dash-1", "{\"action\":\"subscribe\"}"))
                    .verifyComplete();
            StepVerifier.create(handler.handleClientMessage("dash-1", "not json"))
                    .verifyComplete();
            StepVerifier.create(handler.handleClientMessage("dash-1", "{\"timestamp\":1}"))
                    .verifyComplete();

            assertThat(registry.connectionMetrics("dash-1").orElseThrow().getMessagesReceived()).isEqualTo(3);
        }

        private JsonNode readLast() throws Exception {
            return objectMapper.readTree(sentMessages.get(sentMessages.size() - 1));
        }
    }
}
