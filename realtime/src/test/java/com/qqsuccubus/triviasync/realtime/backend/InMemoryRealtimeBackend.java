package com.qqsuccubus.triviasync.realtime.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import com.qqsuccubus.triviasync.core.msg.BroadcastMessage;
import com.qqsuccubus.triviasync.core.msg.ConnectionEvent;
import com.qqsuccubus.triviasync.core.msg.PresenceSignal;
import com.qqsuccubus.triviasync.core.msg.TableChange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Realtime backend held entirely in memory, with failure injection for tests.
 * <p>
 * Handles are grouped by target (table or channel name). Events are delivered synchronously to
 * every subscribed handle of the target.
 * </p>
 */
public class InMemoryRealtimeBackend implements RealtimeBackend {

    private final Map<String, List<TestHandle<?>>> handles = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> subscribeFailures = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> subscribeCalls = new ConcurrentHashMap<>();
    private final Map<String, Map<String, List<PresenceRecord>>> presence = new ConcurrentHashMap<>();
    private final Map<String, Function<Map<String, Object>, JsonNode>> rpcHandlers = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> rpcCalls = new ConcurrentHashMap<>();
    private final List<BroadcastMessage> published = new CopyOnWriteArrayList<>();
    private final Sinks.Many<ConnectionEvent> connectionSink = Sinks.many().multicast().directBestEffort();

    private final AtomicInteger connectCalls = new AtomicInteger();
    private final AtomicInteger connectFailures = new AtomicInteger();
    private volatile boolean publishFails;
    private volatile LongSupplier presenceClock;
    private volatile long presenceStaleAfterMillis;

    // ========== Failure injection ==========

    /**
     * The next {@code times} subscribes to {@code target} fail with a {@link ChannelException}.
     */
    public void failSubscribes(String target, int times) {
        subscribeFailures.computeIfAbsent(target, k -> new AtomicInteger()).set(times);
    }

    public void failConnects(int times) {
        connectFailures.set(times);
    }

    public void failPublishes(boolean fail) {
        publishFails = fail;
    }

    /**
     * Leaves records older than {@code staleAfter} on {@code clock} out of presence syncs.
     */
    public void expirePresence(LongSupplier clock, Duration staleAfter) {
        presenceStaleAfterMillis = staleAfter.toMillis();
        presenceClock = clock;
    }

    public void onRpc(String function, Function<Map<String, Object>, JsonNode> handler) {
        rpcHandlers.put(function, handler);
    }

    // ========== Event emission ==========

    public void emitConnection(ConnectionEvent event) {
        connectionSink.tryEmitNext(event);
    }

    public void emitTableChange(TableChange change) {
        deliver(change.getTable(), change, TableChange.class);
    }

    public void emitBroadcast(String channel, String event, JsonNode payload) {
        deliver(channel, BroadcastMessage.builder()
            .channel(channel)
            .event(event)
            .payload(payload)
            .build(), BroadcastMessage.class);
    }

    public void emitPresence(String channel, PresenceSignal signal) {
        deliver(channel, signal, PresenceSignal.class);
    }

    @SuppressWarnings("unchecked")
    private <E> void deliver(String target, E event, Class<E> type) {
        for (TestHandle<?> handle : handles.getOrDefault(target, List.of())) {
            if (handle.subscribed && handle.type == type && handle.accepts(event)) {
                ((TestHandle<E>) handle).sink.tryEmitNext(event);
            }
        }
    }

    // ========== Inspection ==========

    public int subscribeCalls(String target) {
        AtomicInteger calls = subscribeCalls.get(target);
        return calls == null ? 0 : calls.get();
    }

    public int subscribedHandles(String target) {
        return (int) handles.getOrDefault(target, List.of()).stream().filter(h -> h.subscribed).count();
    }

    public int connectCalls() {
        return connectCalls.get();
    }

    public int rpcCalls(String function) {
        AtomicInteger calls = rpcCalls.get(function);
        return calls == null ? 0 : calls.get();
    }

    public List<BroadcastMessage> getPublished() {
        return List.copyOf(published);
    }

    public Map<String, List<PresenceRecord>> presenceOf(String channel) {
        return Map.copyOf(presence.getOrDefault(channel, Map.of()));
    }

    // ========== RealtimeBackend ==========

    @Override
    public ChannelHandle<TableChange> tableChannel(String table, String filter, String event) {
        return register(new TestHandle<>(table, TableChange.class,
            change -> "*".equals(event) || event.equalsIgnoreCase(change.getType().name())));
    }

    @Override
    public ChannelHandle<BroadcastMessage> broadcastChannel(String channel, String event) {
        return register(new TestHandle<>(channel, BroadcastMessage.class,
            message -> "*".equals(event) || event.equals(message.getEvent())));
    }

    @Override
    public PresenceHandle presenceChannel(String channel, String presenceKey) {
        return register(new TestPresenceHandle(channel, presenceKey));
    }

    private <H extends TestHandle<?>> H register(H handle) {
        handles.computeIfAbsent(handle.target, k -> new CopyOnWriteArrayList<>()).add(handle);
        return handle;
    }

    @Override
    public Mono<Void> publish(String channel, String event, JsonNode payload) {
        return Mono.defer(() -> {
            if (publishFails) {
                return Mono.error(new ChannelException(channel, ChannelException.Status.CHANNEL_ERROR, "publish failed"));
            }
            BroadcastMessage message = BroadcastMessage.builder()
                .channel(channel)
                .event(event)
                .payload(payload)
                .build();
            published.add(message);
            deliver(channel, message, BroadcastMessage.class);
            return Mono.empty();
        });
    }

    @Override
    public Mono<JsonNode> rpc(String function, Map<String, Object> params) {
        return Mono.defer(() -> {
            rpcCalls.computeIfAbsent(function, k -> new AtomicInteger()).incrementAndGet();
            Function<Map<String, Object>, JsonNode> handler = rpcHandlers.get(function);
            if (handler == null) {
                return Mono.error(new IllegalStateException("No such function: " + function));
            }
            return Mono.justOrEmpty(handler.apply(params));
        });
    }

    @Override
    public Flux<ConnectionEvent> connectionEvents() {
        return connectionSink.asFlux();
    }

    @Override
    public Mono<Void> connect() {
        return Mono.defer(() -> {
            connectCalls.incrementAndGet();
            if (connectFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                return Mono.error(new ChannelException("backend", ChannelException.Status.TIMED_OUT, "connect failed"));
            }
            emitConnection(ConnectionEvent.open(0L));
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(connectionSink::tryEmitComplete);
    }

    private class TestHandle<E> implements ChannelHandle<E> {
        final String target;
        final Class<E> type;
        final Predicate<E> filter;
        final Sinks.Many<E> sink = Sinks.many().multicast().directBestEffort();
        volatile boolean subscribed;

        TestHandle(String target, Class<E> type, Predicate<E> filter) {
            this.target = target;
            this.type = type;
            this.filter = filter;
        }

        boolean accepts(Object event) {
            return filter.test(type.cast(event));
        }

        @Override
        public String name() {
            return target;
        }

        @Override
        public Mono<Void> subscribe() {
            return Mono.defer(() -> {
                subscribeCalls.computeIfAbsent(target, k -> new AtomicInteger()).incrementAndGet();
                AtomicInteger failures = subscribeFailures.get(target);
                if (failures != null && failures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                    return Mono.error(new ChannelException(target, ChannelException.Status.CHANNEL_ERROR,
                        "subscribe to " + target + " failed"));
                }
                subscribed = true;
                return Mono.empty();
            });
        }

        @Override
        public Flux<E> events() {
            return sink.asFlux();
        }

        @Override
        public Mono<Void> unsubscribe() {
            return Mono.fromRunnable(() -> {
                subscribed = false;
                handles.getOrDefault(target, new ArrayList<>()).remove(this);
            });
        }
    }

    private class TestPresenceHandle extends TestHandle<PresenceSignal> implements PresenceHandle {
        private final String presenceKey;

        TestPresenceHandle(String channel, String presenceKey) {
            super(channel, PresenceSignal.class, signal -> true);
            this.presenceKey = presenceKey;
        }

        @Override
        public Flux<PresenceSignal> events() {
            return Mono.fromSupplier(() -> PresenceSignal.sync(snapshot()))
                .concatWith(sink.asFlux());
        }

        private Map<String, List<PresenceRecord>> snapshot() {
            Map<String, List<PresenceRecord>> state = new LinkedHashMap<>(presence.getOrDefault(target, Map.of()));
            LongSupplier clock = presenceClock;
            return clock == null ? state : PresenceExpiry.live(state, clock.getAsLong(), presenceStaleAfterMillis);
        }

        @Override
        public Mono<Void> track(PresenceRecord record) {
            return Mono.fromRunnable(() -> {
                presence.computeIfAbsent(target, k -> new ConcurrentHashMap<>()).put(presenceKey, List.of(record));
                emitPresence(target, PresenceSignal.join(presenceKey, List.of(record)));
            });
        }

        @Override
        public Mono<Void> untrack() {
            return Mono.fromRunnable(() -> {
                List<PresenceRecord> left = presence.getOrDefault(target, new ConcurrentHashMap<>()).remove(presenceKey);
                if (left != null) {
                    emitPresence(target, PresenceSignal.leave(presenceKey, left));
                }
            });
        }
    }
}
