package com.z254.commander.broadcast;

import com.z254.commander.config.CommanderProperties;
import com.z254.commander.domain.model.DashboardMessage;
import com.z254.commander.observability.CommanderMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks live dashboard connections and performs best-effort delivery to them.
 * <p>
 * Every connection owns an {@link OutboundQueue}. Deliveries are appended to the queue and
 * written by a single drain loop per connection, each write bounded by the configured write
 * timeout. A failed or timed out write removes the connection; it is never retried.
 */
@Slf4j
@Component
public class ConnectionRegistry {

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();

    private final CommanderProperties.BroadcastProperties config;
    private final DashboardMessageCodec codec;
    private final CommanderMetrics metrics;

    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong totalMessagesSent = new AtomicLong();
    private final AtomicLong droppedMessages = new AtomicLong();
    private final Instant startedAt = Instant.now();

    public ConnectionRegistry(CommanderProperties properties,
                              DashboardMessageCodec codec,
                              CommanderMetrics metrics) {
        this.config = properties.getBroadcast();
        this.codec = codec;
        this.metrics = metrics;
    }

    // ---------------------------------------------------------------------
    // Connection lifecycle
    // ---------------------------------------------------------------------

    /**
     * Registers a connection and sends it the initial state.
     * <p>
     * The initial state is queued before the connection becomes visible to broadcasts, so it
     * is always the first frame the client receives.
     *
     * @return {@code true} when the connection was accepted and the initial state written,
     *         {@code false} when it was rejected or dropped during the initial write
     */
    public Mono<Boolean> connect(String connectionId, DashboardTransport transport, DashboardMessage initialState) {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(transport, "transport");
        return Mono.defer(() -> {
            QueuedMessage initial = initialState != null ? QueuedMessage.pinned(initialState) : null;
            Admission admission = admit(connectionId, transport, initial);
            if (admission == Admission.FULL) {
                log.warn("Connection limit reached ({}), rejecting {}", config.getMaxConnections(), connectionId);
                metrics.recordConnectionRejected();
                return closeQuietly(connectionId, transport, DashboardTransport.CLOSE_OVERLOADED, "Server overloaded")
                        .thenReturn(false);
            }
            if (admission == Admission.DUPLICATE) {
                log.warn("Connection id already registered, rejecting {}", connectionId);
                metrics.recordConnectionRejected();
                return closeQuietly(connectionId, transport, DashboardTransport.CLOSE_POLICY_VIOLATION,
                        "Duplicate connection id").thenReturn(false);
            }

            totalConnections.incrementAndGet();
            metrics.recordConnectionAccepted();
            log.info("Dashboard connected: {} ({} total)", connectionId, connections.size());

            if (initial == null) {
                return Mono.just(true);
            }
            Connection connection = connections.get(connectionId);
            if (connection != null) {
                flush(connection);
            }
            return delivered(initial);
        });
    }

    private Admission admit(String connectionId, DashboardTransport transport, QueuedMessage initial) {
        synchronized (admissionLock) {
            if (connections.containsKey(connectionId)) {
                return Admission.DUPLICATE;
            }
            if (connections.size() >= config.getMaxConnections()) {
                return Admission.FULL;
            }
            Connection connection = new Connection(connectionId, transport, config.getQueueCapacity());
            if (initial != null) {
                connection.getQueue().offer(initial);
            }
            connections.put(connectionId, connection);
            return Admission.ACCEPTED;
        }
    }

    /**
     * Removes a connection and closes its transport. Unknown ids are ignored.
     */
    public Mono<Void> disconnect(String connectionId) {
        return Mono.defer(() -> {
            Connection connection = connections.get(connectionId);
            return connection != null ? unregister(connection) : Mono.empty();
        });
    }

    public Mono<Void> disconnectAll() {
        return Flux.fromIterable(new ArrayList<>(connections.keySet()))
                .flatMap(this::disconnect)
                .then();
    }

    private Mono<Void> unregister(Connection connection) {
        String connectionId = connection.getId();
        if (!connections.remove(connectionId, connection)) {
            return Mono.empty();
        }
        settle(connection.getQueue().clear(), QueuedMessage.Outcome.FAILED);
        metrics.recordConnectionClosed();
        log.info("Dashboard disconnected: {} ({} remaining)", connectionId, connections.size());
        return closeQuietly(connectionId, connection.getTransport(),
                DashboardTransport.CLOSE_NORMAL, "Connection closed");
    }

    private Mono<Void> closeQuietly(String connectionId, DashboardTransport transport, int code, String reason) {
        return Mono.defer(() -> transport.close(code, reason))
                .timeout(config.getWriteTimeout())
                .onErrorResume(e -> {
                    log.warn("Error closing connection {}: {}", connectionId, e.getMessage());
                    return Mono.empty();
                });
    }

    // ---------------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------------

    /**
     * Delivers a message to one connection. Completes once this message has been written,
     * dropped or abandoned with the connection.
     *
     * @return {@code true} only when the message was written
     */
    public Mono<Boolean> sendOne(String connectionId, DashboardMessage message) {
        return Mono.defer(() -> {
            Connection connection = connections.get(connectionId);
            if (connection == null) {
                log.debug("Skipping send to unknown connection {}", connectionId);
                return Mono.just(false);
            }
            QueuedMessage entry = enqueue(connection, message);
            flush(connection);
            return delivered(entry);
        });
    }

    /**
     * Delivers a message to every live connection.
     *
     * @return number of connections that are still up after the write
     */
    public Mono<Integer> broadcastNow(DashboardMessage message) {
        return broadcastBatch(List.of(message));
    }

    /**
     * Appends an ordered batch to every connection queue, then flushes all connections
     * independently of each other. Completes once every queued entry has an outcome.
     *
     * @return number of connections that took the batch without a write failure
     */
    public Mono<Integer> broadcastBatch(List<DashboardMessage> messages) {
        return Mono.defer(() -> {
            List<Connection> targets = new ArrayList<>(connections.values());
            if (messages.isEmpty() || targets.isEmpty()) {
                return Mono.just(0);
            }
            List<List<QueuedMessage>> queued = new ArrayList<>(targets.size());
            for (Connection connection : targets) {
                List<QueuedMessage> entries = new ArrayList<>(messages.size());
                messages.forEach(message -> entries.add(enqueue(connection, message)));
                queued.add(entries);
            }
            targets.forEach(this::flush);
            return countUnfailed(queued);
        });
    }

    /**
     * Flushes connections that still hold queued messages, e.g. after an interrupted flush.
     */
    public Mono<Integer> flushPending() {
        return Mono.defer(() -> {
            List<List<QueuedMessage>> queued = new ArrayList<>();
            for (Connection connection : new ArrayList<>(connections.values())) {
                List<QueuedMessage> entries = connection.getQueue().snapshot();
                if (!entries.isEmpty()) {
                    queued.add(entries);
                    flush(connection);
                }
            }
            return countUnfailed(queued);
        });
    }

    private static Mono<Integer> countUnfailed(List<List<QueuedMessage>> queued) {
        return Flux.fromIterable(queued)
                .flatMap(entries -> Flux.fromIterable(entries)
                        .flatMap(QueuedMessage::outcome)
                        .all(outcome -> outcome != QueuedMessage.Outcome.FAILED))
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue);
    }

    private static Mono<Boolean> delivered(QueuedMessage entry) {
        return entry.outcome().map(outcome -> outcome == QueuedMessage.Outcome.DELIVERED);
    }

    private QueuedMessage enqueue(Connection connection, DashboardMessage message) {
        QueuedMessage entry = QueuedMessage.of(message);
        connection.getQueue().offer(entry).ifPresent(evicted -> {
            evicted.complete(QueuedMessage.Outcome.DROPPED);
            droppedMessages.incrementAndGet();
            metrics.recordMessageDropped();
            log.debug("Queue full for {}, dropped {} message {}", connection.getId(),
                    evicted.getMessage().getType(), evicted.getMessage().getMessageId());
        });
        return entry;
    }

    /**
     * Starts the connection's drain loop unless one is running. The loop is not tied to the
     * caller's subscription; callers wait on the outcomes of their own entries.
     */
    private void flush(Connection connection) {
        if (!connection.tryBeginFlush()) {
            // The running drain loop picks up what was just queued
            return;
        }
        drain(connection).subscribe(
                ignored -> { },
                error -> log.error("Drain loop for {} terminated unexpectedly", connection.getId(), error));
    }

    private Mono<Void> drain(Connection connection) {
        return Mono.defer(() -> {
            if (!isRegistered(connection)) {
                connection.endFlush();
                settle(connection.getQueue().clear(), QueuedMessage.Outcome.FAILED);
                return Mono.empty();
            }
            List<QueuedMessage> batch = connection.getQueue().drain();
            if (batch.isEmpty()) {
                connection.endFlush();
                // Re-check: a producer may have queued between drain and endFlush
                if (!connection.getQueue().isEmpty() && connection.tryBeginFlush()) {
                    return drain(connection);
                }
                return Mono.empty();
            }
            return Flux.fromIterable(batch)
                    .concatMap(entry -> write(connection, entry))
                    .then(Mono.defer(() -> drain(connection)))
                    .onErrorResume(error -> dropConnection(connection, batch, error));
        });
    }

    private Mono<Void> write(Connection connection, QueuedMessage entry) {
        DashboardMessage message = entry.getMessage();
        Optional<String> encoded = codec.encode(message);
        if (encoded.isEmpty()) {
            entry.complete(QueuedMessage.Outcome.DROPPED);
            return Mono.empty();
        }
        return Mono.defer(() -> connection.getTransport().send(encoded.get()))
                .timeout(config.getWriteTimeout())
                .doOnSuccess(ignored -> {
                    connection.recordSent();
                    totalMessagesSent.incrementAndGet();
                    metrics.recordMessageSent();
                    entry.complete(QueuedMessage.Outcome.DELIVERED);
                });
    }

    // The connection is gone before the in-flight entries report failure
    private Mono<Void> dropConnection(Connection connection, List<QueuedMessage> inFlight, Throwable error) {
        connection.endFlush();
        metrics.recordWriteFailure();
        log.warn("Write to {} failed, dropping connection: {}", connection.getId(), describe(error));
        return unregister(connection)
                .doFinally(signal -> settle(inFlight, QueuedMessage.Outcome.FAILED));
    }

    private static void settle(List<QueuedMessage> entries, QueuedMessage.Outcome outcome) {
        entries.forEach(entry -> entry.complete(outcome));
    }

    private boolean isRegistered(Connection connection) {
        return connections.get(connection.getId()) == connection;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    // ---------------------------------------------------------------------
    // Inbound bookkeeping
    // ---------------------------------------------------------------------

    public void recordClientMessage(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.recordReceived();
        }
    }

    public void recordPing(String connectionId, Long latencyMs) {
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.recordPing(latencyMs);
        }
    }

    // ---------------------------------------------------------------------
    // Metrics
    // ---------------------------------------------------------------------

    public int activeConnections() {
        return connections.size();
    }

    public int maxConnections() {
        return config.getMaxConnections();
    }

    public boolean isConnected(String connectionId) {
        return connections.containsKey(connectionId);
    }

    public Optional<ConnectionMetrics> connectionMetrics(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId)).map(Connection::snapshot);
    }

    /**
     * Mean of the latest ping latency reported by each connection, 0 when none has pinged.
     */
    public double averageLatencyMs() {
        return connections.values().stream()
                .map(Connection::getLatencyMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0.0);
    }

    public RegistryMetrics metrics() {
        long uptimeSeconds = Duration.between(startedAt, Instant.now()).getSeconds();
        long sent = totalMessagesSent.get();
        return RegistryMetrics.builder()
                .activeConnections(connections.size())
                .maxConnections(config.getMaxConnections())
                .totalConnections(totalConnections.get())
                .totalMessagesSent(sent)
                .droppedMessages(droppedMessages.get())
                .uptimeSeconds(uptimeSeconds)
                .messagesPerSecond((double) sent / Math.max(uptimeSeconds, 1))
                .build();
    }

    private enum Admission {
        ACCEPTED,
        DUPLICATE,
        FULL
    }
}
