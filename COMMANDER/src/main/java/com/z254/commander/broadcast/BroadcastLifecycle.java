package com.z254.commander.broadcast;

import com.z254.commander.config.CommanderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Starts the batch scheduler with the application context and tears the broadcast layer
 * down in a fixed order: the scheduler stops (with its final flush) before any connection
 * is closed.
 */
@Slf4j
@Component
public class BroadcastLifecycle implements SmartLifecycle {

    private final BatchScheduler scheduler;
    private final ConnectionRegistry registry;
    private final Duration shutdownTimeout;

    private volatile boolean running;

    public BroadcastLifecycle(BatchScheduler scheduler,
                              ConnectionRegistry registry,
                              CommanderProperties properties) {
        this.scheduler = scheduler;
        this.registry = registry;
        this.shutdownTimeout = properties.getBroadcast().getFinalFlushTimeout();
    }

    @Override
    public void start() {
        log.info("Starting dashboard broadcast layer");
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        log.info("Stopping dashboard broadcast layer");
        scheduler.stop();
        int open = registry.activeConnections();
        registry.disconnectAll()
                .timeout(shutdownTimeout)
                .onErrorResume(e -> {
                    log.warn("Closing {} dashboard connections did not complete: {}", open, e.getMessage());
                    return Mono.empty();
                })
                .block();
        running = false;
        log.info("Dashboard broadcast layer stopped, closed {} connections", open);
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
