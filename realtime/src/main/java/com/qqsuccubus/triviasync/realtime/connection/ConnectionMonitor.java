package com.qqsuccubus.triviasync.realtime.connection;

import com.qqsuccubus.triviasync.core.msg.ConnectionEvent;
import com.qqsuccubus.triviasync.core.util.JitterBackoff;
import com.qqsuccubus.triviasync.realtime.backend.RealtimeBackend;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the global transport status and drives jittered reconnects.
 * <p>
 * Delays follow {@link JitterBackoff#next(int)} (3 s base, 30 s cap, up to 1 s jitter). Once
 * {@code maxReconnectAttempts} attempts failed the status turns {@link ConnectionStatus#ERROR}
 * and stays there until {@link #retry()}.
 * </p>
 */
public class ConnectionMonitor {
    private static final Logger log = LoggerFactory.getLogger(ConnectionMonitor.class);

    private final RealtimeBackend backend;
    private final SyncConfig config;
    private final Scheduler scheduler;

    private final AtomicReference<ConnectionStatus> status = new AtomicReference<>(ConnectionStatus.DISCONNECTED);
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final Sinks.Many<ConnectionStatus> statusSink = Sinks.many().replay().latest();
    private final Disposable.Swap pendingReconnect = Disposables.swap();
    private volatile Throwable lastError;

    private final Disposable events;

    public ConnectionMonitor(RealtimeBackend backend, SyncConfig config, Scheduler scheduler) {
        this.backend = backend;
        this.config = config;
        this.scheduler = scheduler;
        statusSink.tryEmitNext(ConnectionStatus.DISCONNECTED);

        this.events = backend.connectionEvents()
            .publishOn(scheduler)
            .subscribe(this::onEvent,
                err -> log.error("Connection event stream failed", err));
    }

    /**
     * Opens the transport.
     */
    public void start() {
        transition(ConnectionStatus.CONNECTING);
        connectNow();
    }

    /**
     * Manual retry from any state: resets the attempt counter and connects immediately.
     */
    public void retry() {
        log.info("Manual reconnect requested (status={})", status.get());
        pendingReconnect.update(Disposables.disposed());
        reconnectAttempts.set(0);
        transition(ConnectionStatus.RECONNECTING);
        connectNow();
    }

    private void onEvent(ConnectionEvent event) {
        switch (event.getKind()) {
            case OPEN -> {
                pendingReconnect.update(Disposables.disposed());
                reconnectAttempts.set(0);
                lastError = null;
                transition(ConnectionStatus.CONNECTED);
            }
            case CLOSE -> {
                if (status.get() == ConnectionStatus.CONNECTED) {
                    transition(ConnectionStatus.DISCONNECTED);
                    scheduleReconnect();
                }
            }
            case ERROR -> {
                lastError = event.getCause();
                log.warn("Transport error while {}", status.get(), event.getCause());
            }
        }
    }

    private void connectNow() {
        backend.connect()
            .subscribe(v -> { },
                err -> {
                    lastError = err;
                    log.warn("Connect attempt failed", err);
                    scheduleReconnect();
                });
    }

    private void scheduleReconnect() {
        int attempt = reconnectAttempts.get();
        if (attempt >= config.getMaxReconnectAttempts()) {
            log.error("Giving up after {} reconnect attempts", attempt);
            transition(ConnectionStatus.ERROR);
            return;
        }
        reconnectAttempts.incrementAndGet();
        Duration delay = JitterBackoff.next(attempt);
        transition(ConnectionStatus.RECONNECTING);
        log.info("Reconnecting in {} ms (attempt {}/{})", delay.toMillis(), attempt + 1, config.getMaxReconnectAttempts());

        pendingReconnect.update(Mono.delay(delay, scheduler)
            .subscribe(tick -> connectNow()));
    }

    private void transition(ConnectionStatus next) {
        ConnectionStatus previous = status.getAndSet(next);
        if (previous != next) {
            log.info("Connection status {} -> {}", previous, next);
            statusSink.tryEmitNext(next);
        }
    }

    public ConnectionStatus getStatus() {
        return status.get();
    }

    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    public Throwable getLastError() {
        return lastError;
    }

    /**
     * @return status transitions, replaying the current status to new subscribers
     */
    public Flux<ConnectionStatus> statuses() {
        return statusSink.asFlux();
    }

    public void dispose() {
        pendingReconnect.dispose();
        events.dispose();
        statusSink.tryEmitComplete();
    }
}
