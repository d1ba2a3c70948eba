package com.qqsuccubus.triviasync.realtime.channel;

import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import com.qqsuccubus.triviasync.core.msg.BroadcastMessage;
import com.qqsuccubus.triviasync.core.msg.ConnectionEvent;
import com.qqsuccubus.triviasync.core.msg.PresenceSignal;
import com.qqsuccubus.triviasync.core.msg.TableChange;
import com.qqsuccubus.triviasync.core.util.JitterBackoff;
import com.qqsuccubus.triviasync.realtime.backend.ChannelHandle;
import com.qqsuccubus.triviasync.realtime.backend.PresenceHandle;
import com.qqsuccubus.triviasync.realtime.backend.RealtimeBackend;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import com.qqsuccubus.triviasync.realtime.metrics.MetricsService;
import com.qqsuccubus.triviasync.realtime.optimizer.PerformanceOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Sole owner of transport channel handles.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Create table-change, broadcast and presence subscriptions and reject duplicate ids</li>
 *   <li>Dispatch events to listeners in delivery order on the sync scheduler</li>
 *   <li>Mark everything inactive on transport close, restore it on reopen and announce each
 *   restored subscription</li>
 *   <li>Report per-subscription health and aggregate metrics</li>
 * </ul>
 * </p>
 */
public class ChannelManager {
    private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

    private static final Duration RESUBSCRIBE_BASE = Duration.ofSeconds(1);
    private static final Duration RESUBSCRIBE_MAX = Duration.ofSeconds(30);
    private static final Duration RESUBSCRIBE_JITTER = Duration.ofMillis(500);

    private final RealtimeBackend backend;
    private final PerformanceOptimizer optimizer;
    private final MetricsService metricsService;
    private final SyncConfig config;
    private final Scheduler scheduler;

    // Subscriptions: id -> subscription
    private final Map<String, ChannelSubscription> subscriptions = new ConcurrentHashMap<>();

    private final AtomicLong eventCount = new AtomicLong();
    private final AtomicInteger connectionAttempts = new AtomicInteger();
    private volatile long lastReconnectTime;
    private final Deque<Double> latencies = new ArrayDeque<>();

    private final Sinks.Many<String> resubscribedSink = Sinks.many().multicast().directBestEffort();

    private final Disposable connectionEvents;

    public ChannelManager(RealtimeBackend backend, PerformanceOptimizer optimizer, MetricsService metricsService,
                          SyncConfig config, Scheduler scheduler) {
        this.backend = backend;
        this.optimizer = optimizer;
        this.metricsService = metricsService;
        this.config = config;
        this.scheduler = scheduler;

        metricsService.registerActiveChannelsGauge(() -> subscriptions.values().stream()
            .filter(ChannelSubscription::isActive)
            .count());

        this.connectionEvents = backend.connectionEvents()
            .publishOn(scheduler)
            .subscribe(this::onConnectionEvent,
                err -> log.error("Connection event stream failed", err));
    }

    /**
     * Subscribes to row changes of a table.
     *
     * @param table    Table name
     * @param options  Event, filter and optional id
     * @param listener Receives each change
     * @return subscription id (the existing one if {@code options.id} is already taken)
     */
    public Mono<String> subscribeTable(String table, TableOptions options, Consumer<TableChange> listener) {
        String id = options.getId() != null ? options.getId() : deriveId(SubscriptionKind.TABLE_CHANGE, table);
        return register(id, () -> new ChannelSubscription(id, SubscriptionKind.TABLE_CHANGE, table,
            options.getEvent(), options.getFilter(), now(),
            () -> backend.tableChannel(table, options.getFilter(), options.getEvent()),
            TableChange.class, listener));
    }

    public Mono<String> subscribeBroadcast(String channel, BroadcastOptions options, Consumer<BroadcastMessage> listener) {
        String id = options.getId() != null ? options.getId() : deriveId(SubscriptionKind.BROADCAST, channel);
        return register(id, () -> new ChannelSubscription(id, SubscriptionKind.BROADCAST, channel,
            options.getEvent(), null, now(),
            () -> backend.broadcastChannel(channel, options.getEvent()),
            BroadcastMessage.class, listener));
    }

    /**
     * Subscribes to a presence channel and tracks {@code record} once subscribed.
     *
     * @param channel   Presence channel name
     * @param record    Record to track under {@code record.userId}, may be null to only observe
     * @param callbacks Sync/join/leave handlers
     * @param id        Explicit id or null
     * @return subscription id
     */
    public Mono<String> subscribePresence(String channel, PresenceRecord record, PresenceCallbacks callbacks, String id) {
        String subscriptionId = id != null ? id : deriveId(SubscriptionKind.PRESENCE, channel);
        String presenceKey = record != null ? record.getUserId() : subscriptionId;
        return register(subscriptionId, () -> {
            ChannelSubscription sub = new ChannelSubscription(subscriptionId, SubscriptionKind.PRESENCE, channel,
                "*", null, now(),
                () -> backend.presenceChannel(channel, presenceKey),
                PresenceSignal.class, signal -> dispatchPresence(signal, callbacks));
            sub.setTrackedPresence(record);
            return sub;
        });
    }

    private static void dispatchPresence(PresenceSignal signal, PresenceCallbacks callbacks) {
        switch (signal.getKind()) {
            case SYNC -> callbacks.getOnSync().accept(signal.getState());
            case JOIN -> callbacks.getOnJoin().accept(signal.getKey(), signal.getPresences());
            case LEAVE -> callbacks.getOnLeave().accept(signal.getKey(), signal.getPresences());
        }
    }

    private Mono<String> register(String id, Supplier<ChannelSubscription> factory) {
        return Mono.defer(() -> {
            ChannelSubscription created = factory.get();
            ChannelSubscription existing = subscriptions.putIfAbsent(id, created);
            if (existing != null) {
                log.warn("Subscription {} already exists, keeping the existing one", id);
                return Mono.just(id);
            }

            return activate(created)
                .thenReturn(id)
                .doOnSuccess(v -> log.info("Subscribed {} ({} {})", id, created.getKind().wireName(), created.getTarget()))
                .onErrorResume(err -> {
                    log.error("Failed to subscribe {} ({})", id, created.getTarget(), err);
                    subscriptions.remove(id, created);
                    created.setState(SubscriptionState.REMOVED);
                    created.replaceEventStream(null);
                    return Mono.error(err);
                });
        });
    }

    /**
     * Obtains a fresh handle, subscribes it, wires its events and tracks presence.
     */
    private Mono<Void> activate(ChannelSubscription sub) {
        return Mono.defer(() -> {
            ChannelHandle<?> previous = sub.getHandle();
            ChannelHandle<?> handle = sub.newHandle();
            sub.setState(SubscriptionState.SUBSCRIBING);

            return release(sub, previous)
                .then(handle.subscribe())
                .then(Mono.fromRunnable(() -> {
                    if (sub.getState() == SubscriptionState.REMOVED) {
                        handle.unsubscribe().subscribe(v -> { },
                            err -> log.warn("Late unsubscribe of {} failed", sub.getId(), err));
                        return;
                    }
                    sub.replaceEventStream(wireEvents(sub, handle));
                    sub.setState(SubscriptionState.ACTIVE);
                    sub.touch(now());
                }))
                .then(trackIfPresence(sub));
        });
    }

    private static Mono<Void> release(ChannelSubscription sub, ChannelHandle<?> previous) {
        if (previous == null) {
            return Mono.empty();
        }
        return previous.unsubscribe()
            .onErrorResume(err -> {
                log.debug("Releasing stale handle of {} failed", sub.getId(), err);
                return Mono.empty();
            });
    }

    private Disposable wireEvents(ChannelSubscription sub, ChannelHandle<?> handle) {
        Flux<?> events = handle.events();
        return events
            .onBackpressureBuffer(config.getSubscriptionBufferSize(),
                dropped -> {
                    log.warn("Event buffer of {} full, dropping oldest event", sub.getId());
                    optimizer.recordDroppedEvent();
                },
                BufferOverflowStrategy.DROP_OLDEST)
            .publishOn(scheduler)
            .subscribe(event -> dispatch(sub, event),
                err -> log.error("Event stream of {} failed", sub.getId(), err));
    }

    private Mono<Void> trackIfPresence(ChannelSubscription sub) {
        PresenceHandle presence = sub.presenceHandle();
        PresenceRecord record = sub.getTrackedPresence();
        if (presence == null || record == null || sub.getState() == SubscriptionState.REMOVED) {
            return Mono.empty();
        }
        return presence.track(record)
            .onErrorResume(err -> {
                log.warn("Failed to track presence on {}", sub.getId(), err);
                return Mono.empty();
            });
    }

    private void dispatch(ChannelSubscription sub, Object event) {
        if (sub.getState() == SubscriptionState.REMOVED) {
            return;
        }
        sub.touch(now());
        eventCount.incrementAndGet();
        optimizer.recordEvent();

        long start = System.nanoTime();
        try {
            sub.dispatch(event);
        } catch (RuntimeException e) {
            log.error("Listener of {} failed", sub.getId(), e);
        } finally {
            long elapsed = System.nanoTime() - start;
            double millis = elapsed / 1_000_000.0;
            recordLatency(millis);
            optimizer.recordLatency(millis);
            metricsService.recordChannelEvent(sub.getKind().wireName(), elapsed);
        }
    }

    private void recordLatency(double millis) {
        synchronized (latencies) {
            latencies.addLast(millis);
            while (latencies.size() > config.getChannelLatencyWindow()) {
                latencies.pollFirst();
            }
        }
    }

    // ---------------------------------------------------------------- presence tracking

    /**
     * Re-tracks a presence subscription with a new record.
     */
    public Mono<Void> updatePresence(String id, PresenceRecord record) {
        return Mono.defer(() -> {
            ChannelSubscription sub = subscriptions.get(id);
            if (sub == null || sub.getKind() != SubscriptionKind.PRESENCE) {
                log.warn("No presence subscription {} to update", id);
                return Mono.empty();
            }
            sub.setTrackedPresence(record);
            PresenceHandle presence = sub.presenceHandle();
            if (!sub.isActive() || presence == null) {
                // Tracked on resubscribe
                return Mono.empty();
            }
            return presence.track(record);
        });
    }

    public Mono<Void> untrackPresence(String id) {
        return Mono.defer(() -> {
            ChannelSubscription sub = subscriptions.get(id);
            if (sub == null || sub.getKind() != SubscriptionKind.PRESENCE) {
                log.warn("No presence subscription {} to untrack", id);
                return Mono.empty();
            }
            sub.setTrackedPresence(null);
            PresenceHandle presence = sub.presenceHandle();
            return presence == null || !sub.isActive() ? Mono.empty() : presence.untrack();
        });
    }

    // ---------------------------------------------------------------- transport lifecycle

    private void onConnectionEvent(ConnectionEvent event) {
        metricsService.recordConnectionEvent(event.getKind().name().toLowerCase());
        switch (event.getKind()) {
            case OPEN -> resubscribeInactive();
            case CLOSE -> markAllInactive();
            case ERROR -> {
                int attempts = connectionAttempts.incrementAndGet();
                log.warn("Transport error (attempt {})", attempts, event.getCause());
            }
        }
    }

    private void markAllInactive() {
        log.info("Transport closed, marking {} subscriptions inactive", subscriptions.size());
        subscriptions.values().forEach(sub -> {
            if (sub.getState() != SubscriptionState.REMOVED) {
                sub.setState(SubscriptionState.INACTIVE);
                sub.replaceEventStream(null);
            }
        });
    }

    private void resubscribeInactive() {
        lastReconnectTime = now();
        subscriptions.values().stream()
            .filter(sub -> sub.getState() == SubscriptionState.INACTIVE)
            .forEach(this::resubscribe);
    }

    private void resubscribe(ChannelSubscription sub) {
        int attempt = sub.incrementConnectionAttempts();
        log.info("Resubscribing {} (attempt {})", sub.getId(), attempt);

        activate(sub)
            .retryWhen(JitterBackoff.retry(config.getMaxResubscribeRetries(),
                RESUBSCRIBE_BASE, RESUBSCRIBE_MAX, RESUBSCRIBE_JITTER, scheduler))
            .subscribe(
                v -> { },
                err -> {
                    log.error("Giving up resubscribing {}", sub.getId(), err);
                    if (sub.getState() != SubscriptionState.REMOVED) {
                        sub.setState(SubscriptionState.INACTIVE);
                    }
                    metricsService.recordResubscribe(false);
                },
                () -> {
                    if (sub.getState() == SubscriptionState.REMOVED) {
                        // Unsubscribed while the resubscribe was in flight
                        sub.replaceEventStream(null);
                        return;
                    }
                    metricsService.recordResubscribe(true);
                    synchronized (resubscribedSink) {
                        resubscribedSink.tryEmitNext(sub.getId());
                    }
                });
    }

    /**
     * Ids of subscriptions that became active again after a transport reopen.
     */
    public Flux<String> resubscribed() {
        return resubscribedSink.asFlux();
    }

    // ---------------------------------------------------------------- unsubscribe

    /**
     * Removes a subscription. Unknown ids only log a warning.
     */
    public Mono<Void> unsubscribe(String id) {
        return Mono.defer(() -> {
            ChannelSubscription sub = subscriptions.remove(id);
            if (sub == null) {
                log.warn("Unsubscribe of unknown subscription {}", id);
                return Mono.empty();
            }
            boolean wasActive = sub.isActive();
            sub.setState(SubscriptionState.REMOVED);
            sub.replaceEventStream(null);

            ChannelHandle<?> handle = sub.getHandle();
            if (handle == null) {
                return Mono.empty();
            }
            Mono<Void> untrack = wasActive && sub.presenceHandle() != null && sub.getTrackedPresence() != null
                ? sub.presenceHandle().untrack()
                : Mono.empty();

            return untrack
                .then(handle.unsubscribe())
                .doOnSuccess(v -> log.info("Unsubscribed {}", id))
                .onErrorResume(err -> {
                    log.warn("Transport unsubscribe of {} failed", id, err);
                    return Mono.empty();
                });
        });
    }

    public Mono<Void> unsubscribeAll() {
        return Flux.fromIterable(List.copyOf(subscriptions.keySet()))
            .flatMap(this::unsubscribe)
            .then();
    }

    /**
     * Stops observing the transport and removes every subscription.
     */
    public Mono<Void> dispose() {
        connectionEvents.dispose();
        synchronized (resubscribedSink) {
            resubscribedSink.tryEmitComplete();
        }
        return unsubscribeAll();
    }

    // ---------------------------------------------------------------- introspection

    public Optional<ChannelSubscription> getSubscription(String id) {
        return Optional.ofNullable(subscriptions.get(id));
    }

    public List<ChannelSubscription> getAllSubscriptions() {
        return List.copyOf(subscriptions.values());
    }

    public boolean isActive(String id) {
        ChannelSubscription sub = subscriptions.get(id);
        return sub != null && sub.isActive();
    }

    public ChannelMetrics getMetrics() {
        double avgLatency;
        synchronized (latencies) {
            avgLatency = latencies.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
        return ChannelMetrics.builder()
            .totalSubscriptions(subscriptions.size())
            .activeSubscriptions((int) subscriptions.values().stream().filter(ChannelSubscription::isActive).count())
            .averageLatencyMs(avgLatency)
            .connectionAttempts(connectionAttempts.get())
            .lastReconnectTime(lastReconnectTime)
            .eventCount(eventCount.get())
            .build();
    }

    public Map<String, ChannelHealth> getChannelHealth() {
        Map<String, ChannelHealth> health = new LinkedHashMap<>();
        subscriptions.forEach((id, sub) -> health.put(id, sub.health()));
        return health;
    }

    private String deriveId(SubscriptionKind kind, String target) {
        return kind.wireName() + "_" + target + "_" + now();
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}
