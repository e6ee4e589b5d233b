package com.z254.commander.api.websocket;

import com.z254.commander.broadcast.DashboardTransport;
import com.z254.commander.broadcast.TransportWriteException;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link DashboardTransport} over a WebFlux {@link WebSocketSession}.
 * <p>
 * Frames are buffered in a bounded sink that feeds {@code session.send}. A client that
 * stops reading fills the buffer, and the next write fails.
 */
public class WebSocketSessionTransport implements DashboardTransport {

    private final WebSocketSession session;
    private final Sinks.Many<String> outbound;
    private final AtomicBoolean closed = new AtomicBoolean();

    public WebSocketSessionTransport(WebSocketSession session, int bufferSize) {
        this.session = session;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize));
    }

    @Override
    public Mono<Void> send(String payload) {
        return Mono.defer(() -> {
            Sinks.EmitResult result;
            synchronized (outbound) {
                result = outbound.tryEmitNext(payload);
            }
            if (result.isFailure()) {
                return Mono.error(new TransportWriteException(
                        "Session " + session.getId() + " rejected frame: " + result));
            }
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> close(int code, String reason) {
        if (!closed.compareAndSet(false, true)) {
            return Mono.empty();
        }
        synchronized (outbound) {
            outbound.tryEmitComplete();
        }
        return session.close(new CloseStatus(code, reason));
    }

    /**
     * Frames to hand to {@code session.send}. Completes when the transport is closed.
     */
    public Flux<String> outbound() {
        return outbound.asFlux();
    }

    public boolean isClosed() {
        return closed.get();
    }
}
