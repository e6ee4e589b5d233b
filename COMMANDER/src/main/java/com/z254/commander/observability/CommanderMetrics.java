package com.z254.commander.observability;

import com.z254.commander.domain.model.IncidentPhase;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for COMMANDER.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Dashboard connections (accepted, rejected, closed)</li>
 *     <li>Message delivery (sent, dropped by backpressure, write failures)</li>
 *     <li>Incident processing (started, completed, failed, phase latency)</li>
 * </ul>
 */
@Component
public class CommanderMetrics {

    private final MeterRegistry meterRegistry;

    // Connection metrics
    @Getter
    private final Counter connectionsAccepted;
    @Getter
    private final Counter connectionsRejected;
    @Getter
    private final Counter connectionsClosed;
    private final AtomicInteger activeConnections;

    // Delivery metrics
    @Getter
    private final Counter messagesSent;
    @Getter
    private final Counter messagesDropped;
    @Getter
    private final Counter writeFailures;
    private final Timer flushDuration;

    // Incident metrics
    @Getter
    private final Counter incidentsStarted;
    @Getter
    private final Counter incidentsCompleted;
    @Getter
    private final Counter incidentsFailed;
    @Getter
    private final Counter phaseTimeouts;
    private final AtomicInteger activeIncidents;
    private final Map<IncidentPhase, Timer> phaseTimers = new ConcurrentHashMap<>();

    public CommanderMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.connectionsAccepted = Counter.builder("commander.connections.accepted")
                .description("Dashboard connections accepted")
                .register(meterRegistry);
        this.connectionsRejected = Counter.builder("commander.connections.rejected")
                .description("Dashboard connections rejected at the connection limit")
                .register(meterRegistry);
        this.connectionsClosed = Counter.builder("commander.connections.closed")
                .description("Dashboard connections removed from the registry")
                .register(meterRegistry);
        this.activeConnections = meterRegistry.gauge("commander.connections.active", new AtomicInteger(0));

        this.messagesSent = Counter.builder("commander.messages.sent")
                .description("Messages written to dashboard transports")
                .register(meterRegistry);
        this.messagesDropped = Counter.builder("commander.messages.dropped")
                .description("Messages evicted from full outbound queues")
                .register(meterRegistry);
        this.writeFailures = Counter.builder("commander.messages.write.failures")
                .description("Transport writes that failed or timed out")
                .register(meterRegistry);
        this.flushDuration = Timer.builder("commander.batch.flush")
                .description("Duration of one batch scheduler flush")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.incidentsStarted = Counter.builder("commander.incidents.started")
                .description("Incidents whose processing started")
                .register(meterRegistry);
        this.incidentsCompleted = Counter.builder("commander.incidents.completed")
                .description("Incidents processed through every phase")
                .register(meterRegistry);
        this.incidentsFailed = Counter.builder("commander.incidents.failed")
                .description("Incidents aborted by a phase failure")
                .register(meterRegistry);
        this.phaseTimeouts = Counter.builder("commander.phases.timeouts")
                .description("Phase callbacks that exceeded the phase timeout")
                .register(meterRegistry);
        this.activeIncidents = meterRegistry.gauge("commander.incidents.active", new AtomicInteger(0));
    }

    // ========== Connection Methods ==========

    public void recordConnectionAccepted() {
        connectionsAccepted.increment();
        activeConnections.incrementAndGet();
    }

    public void recordConnectionRejected() {
        connectionsRejected.increment();
    }

    public void recordConnectionClosed() {
        connectionsClosed.increment();
        activeConnections.decrementAndGet();
    }

    // ========== Delivery Methods ==========

    public void recordMessageSent() {
        messagesSent.increment();
    }

    public void recordMessageDropped() {
        messagesDropped.increment();
    }

    public void recordWriteFailure() {
        writeFailures.increment();
    }

    public Timer.Sample startFlush() {
        return Timer.start(meterRegistry);
    }

    public void stopFlush(Timer.Sample sample) {
        sample.stop(flushDuration);
    }

    // ========== Incident Methods ==========

    public void recordIncidentStarted() {
        incidentsStarted.increment();
        activeIncidents.incrementAndGet();
    }

    public void recordIncidentCompleted() {
        incidentsCompleted.increment();
        activeIncidents.decrementAndGet();
    }

    public void recordIncidentFailed() {
        incidentsFailed.increment();
        activeIncidents.decrementAndGet();
    }

    public void recordPhaseTimeout() {
        phaseTimeouts.increment();
    }

    public void recordPhaseDuration(IncidentPhase phase, Duration duration) {
        phaseTimers.computeIfAbsent(phase, p -> Timer.builder("commander.phases.duration")
                        .description("Phase callback duration")
                        .tag("phase", p.wireName())
                        .publishPercentiles(0.5, 0.95)
                        .register(meterRegistry))
                .record(duration);
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public int getActiveIncidents() {
        return activeIncidents.get();
    }
}
