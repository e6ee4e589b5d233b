package com.z254.commander.broadcast;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One registered dashboard connection. Owned by {@link ConnectionRegistry}.
 */
@Getter
class Connection {

    private final String id;
    private final DashboardTransport transport;
    private final OutboundQueue queue;
    private final Instant connectedAt = Instant.now();
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private volatile Instant lastPing;
    private volatile Long latencyMs;

    // Single drain loop per connection
    private final AtomicBoolean flushing = new AtomicBoolean();

    Connection(String id, DashboardTransport transport, int queueCapacity) {
        this.id = id;
        this.transport = transport;
        this.queue = new OutboundQueue(queueCapacity);
    }

    boolean tryBeginFlush() {
        return flushing.compareAndSet(false, true);
    }

    void endFlush() {
        flushing.set(false);
    }

    void recordSent() {
        messagesSent.incrementAndGet();
    }

    void recordReceived() {
        messagesReceived.incrementAndGet();
    }

    void recordPing(Long latencyMs) {
        this.lastPing = Instant.now();
        if (latencyMs != null) {
            this.latencyMs = latencyMs;
        }
    }

    ConnectionMetrics snapshot() {
        return ConnectionMetrics.builder()
                .connectionId(id)
                .connectedAt(connectedAt)
                .messagesSent(messagesSent.get())
                .messagesReceived(messagesReceived.get())
                .queuedMessages(queue.size())
                .lastPing(lastPing)
                .latencyMs(latencyMs)
                .build();
    }
}
