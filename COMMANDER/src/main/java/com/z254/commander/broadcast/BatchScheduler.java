package com.z254.commander.broadcast;

import com.z254.commander.config.CommanderProperties;
import com.z254.commander.domain.model.DashboardMessage;
import com.z254.commander.observability.CommanderMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Periodic flush point between message producers and the {@link ConnectionRegistry}.
 * <p>
 * Producers {@link #enqueue(DashboardMessage)} into a pending buffer at any time. While
 * running, each tick swaps the buffer out, orders it by priority (highest first, FIFO
 * among equals) and fans it out through the registry. Ticks run on a dedicated single
 * thread and never overlap.
 */
@Slf4j
@Component
public class BatchScheduler {

    public enum State {
        STOPPED,
        RUNNING
    }

    static final Comparator<DashboardMessage> PRIORITY_ORDER =
            Comparator.comparingInt(DashboardMessage::getPriority).reversed();

    private final ConnectionRegistry registry;
    private final CommanderMetrics metrics;
    private final Duration interval;
    private final Duration finalFlushTimeout;

    private final Object bufferLock = new Object();
    private List<DashboardMessage> pending = new ArrayList<>();

    private volatile State state = State.STOPPED;
    private Sinks.One<Boolean> stopSignal;
    private Mono<Void> tickLoop;
    private Disposable ticker;
    private Scheduler tickScheduler;

    public BatchScheduler(ConnectionRegistry registry,
                          CommanderMetrics metrics,
                          CommanderProperties properties) {
        this.registry = registry;
        this.metrics = metrics;
        this.interval = properties.getBroadcast().getBatchInterval();
        this.finalFlushTimeout = properties.getBroadcast().getFinalFlushTimeout();
    }

    /**
     * Buffers a message for the next tick. Never blocks on delivery.
     */
    public void enqueue(DashboardMessage message) {
        Objects.requireNonNull(message, "message");
        synchronized (bufferLock) {
            pending.add(message);
        }
    }

    public synchronized void start() {
        if (state == State.RUNNING) {
            log.info("Batch scheduler already running, ignoring start");
            return;
        }
        tickScheduler = Schedulers.newSingle("dashboard-batch");
        stopSignal = Sinks.one();
        tickLoop = Flux.interval(interval, interval, tickScheduler)
                .takeUntilOther(stopSignal.asMono())
                .onBackpressureDrop(tick -> log.debug("Batch tick {} skipped, previous flush still running", tick))
                .concatMap(tick -> flush(), 1)
                .then()
                .cache();
        ticker = tickLoop.subscribe(
                ignored -> { },
                error -> log.error("Batch scheduler terminated unexpectedly", error));
        state = State.RUNNING;
        log.info("Batch scheduler started (interval {}ms)", interval.toMillis());
    }

    /**
     * Stops ticking, lets an in-flight flush finish and flushes whatever is still buffered.
     * Each of the two waits is bounded by the configured final flush timeout.
     */
    public synchronized void stop() {
        if (state == State.STOPPED) {
            log.debug("Batch scheduler already stopped, ignoring stop");
            return;
        }
        stopSignal.tryEmitValue(Boolean.TRUE);
        awaitQuietly(tickLoop, "In-flight flush");
        ticker.dispose();
        tickScheduler.dispose();
        state = State.STOPPED;

        int remaining = pendingCount();
        awaitQuietly(flush().then(registry.flushPending()).then(), "Final flush");
        log.info("Batch scheduler stopped, final flush of {} messages done", remaining);
    }

    private void awaitQuietly(Mono<Void> work, String description) {
        work.timeout(finalFlushTimeout)
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("{} did not finish within {}ms", description, finalFlushTimeout.toMillis());
                    return Mono.empty();
                })
                .block();
    }

    /**
     * Swaps out the pending buffer and delivers it.
     *
     * @return number of connections that received the batch
     */
    Mono<Integer> flush() {
        return Mono.defer(() -> {
            List<DashboardMessage> batch = swapPending();
            if (batch.isEmpty()) {
                return Mono.just(0);
            }
            batch.sort(PRIORITY_ORDER);
            Timer.Sample sample = metrics.startFlush();
            log.debug("Flushing batch of {} messages", batch.size());
            return registry.broadcastBatch(batch)
                    .doFinally(signal -> metrics.stopFlush(sample));
        }).onErrorResume(e -> {
            log.error("Batch flush failed", e);
            return Mono.just(0);
        });
    }

    private List<DashboardMessage> swapPending() {
        synchronized (bufferLock) {
            List<DashboardMessage> batch = pending;
            pending = new ArrayList<>();
            return batch;
        }
    }

    public int pendingCount() {
        synchronized (bufferLock) {
            return pending.size();
        }
    }

    public State state() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }
}
