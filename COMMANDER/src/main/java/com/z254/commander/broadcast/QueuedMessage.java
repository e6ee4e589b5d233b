package com.z254.commander.broadcast;

import com.z254.commander.domain.model.DashboardMessage;
import lombok.Getter;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A message waiting in one connection's {@link OutboundQueue}, together with the
 * outcome of its delivery. The outcome is settled exactly once.
 */
public class QueuedMessage {

    public enum Outcome {
        /** Written to the transport. */
        DELIVERED,
        /** Evicted from a full queue or not encodable. The connection stays up. */
        DROPPED,
        /** The connection was removed before or while writing it. */
        FAILED
    }

    @Getter
    private final DashboardMessage message;

    /**
     * Pinned entries are evicted only when nothing else is left to evict.
     */
    @Getter
    private final boolean pinned;

    private final AtomicBoolean settled = new AtomicBoolean();
    private final Sinks.One<Outcome> outcome = Sinks.one();

    private QueuedMessage(DashboardMessage message, boolean pinned) {
        this.message = message;
        this.pinned = pinned;
    }

    public static QueuedMessage of(DashboardMessage message) {
        return new QueuedMessage(message, false);
    }

    public static QueuedMessage pinned(DashboardMessage message) {
        return new QueuedMessage(message, true);
    }

    /**
     * Settles the outcome. Later calls are ignored.
     */
    public void complete(Outcome result) {
        if (settled.compareAndSet(false, true)) {
            outcome.tryEmitValue(result);
        }
    }

    public boolean isSettled() {
        return settled.get();
    }

    public Mono<Outcome> outcome() {
        return outcome.asMono();
    }
}
