package com.qqsuccubus.triviasync.realtime.redis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import com.qqsuccubus.triviasync.core.msg.BroadcastMessage;
import com.qqsuccubus.triviasync.core.msg.ConnectionEvent;
import com.qqsuccubus.triviasync.core.msg.PresenceSignal;
import com.qqsuccubus.triviasync.core.msg.TableChange;
import com.qqsuccubus.triviasync.core.redis.Keys;
import com.qqsuccubus.triviasync.core.util.JsonUtils;
import com.qqsuccubus.triviasync.realtime.backend.ChannelException;
import com.qqsuccubus.triviasync.realtime.backend.ChannelHandle;
import com.qqsuccubus.triviasync.realtime.backend.PresenceExpiry;
import com.qqsuccubus.triviasync.realtime.backend.PresenceHandle;
import com.qqsuccubus.triviasync.realtime.backend.RealtimeBackend;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisChannelHandler;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionStateListener;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.pubsub.api.reactive.ChannelMessage;
import io.lettuce.core.pubsub.api.reactive.RedisPubSubReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Realtime backend on Redis using the Lettuce reactive API.
 * <p>
 * <b>Mapping:</b>
 * <ul>
 *   <li>Table changes and broadcasts: pub/sub channels from {@link Keys}, JSON payloads</li>
 *   <li>Presence: one hash per channel holding each key's records, plus a pub/sub channel for
 *       join/leave diffs. Entries not refreshed within {@code presenceStaleAfter} are dropped
 *       when a subscriber loads the initial state</li>
 *   <li>RPC: Redis functions ({@code FCALL}) with the JSON-encoded parameters as single argument</li>
 *   <li>Lifecycle: a {@link RedisConnectionStateListener} on the client</li>
 * </ul>
 * </p>
 */
public class RedisRealtimeBackend implements RealtimeBackend, RedisConnectionStateListener {
    private static final Logger log = LoggerFactory.getLogger(RedisRealtimeBackend.class);

    private static final Duration SUBSCRIBE_TIMEOUT = Duration.ofSeconds(10);

    private final SyncConfig config;
    private final RedisClient client;
    private final AtomicReference<StatefulRedisConnection<String, String>> connection = new AtomicReference<>();
    private final AtomicReference<StatefulRedisPubSubConnection<String, String>> pubSubConnection = new AtomicReference<>();

    // Redis channel -> local handles subscribed to it
    private final Map<String, AtomicInteger> channelRefs = new ConcurrentHashMap<>();
    private final Sinks.Many<ConnectionEvent> connectionSink = Sinks.many().multicast().directBestEffort();

    public RedisRealtimeBackend(SyncConfig config) {
        this.config = config;
        this.client = RedisClient.create(config.getRedisUrl());
        this.client.addListener(this);
    }

    @Override
    public Mono<Void> connect() {
        return Mono.fromRunnable(() -> {
                if (connection.get() == null) {
                    connection.set(client.connect());
                }
                if (pubSubConnection.get() == null) {
                    pubSubConnection.set(client.connectPubSub());
                }
                // Existing connections reconnect on their own; onRedisConnected reports the reopen
                requireOpen(connection.get(), "command");
                requireOpen(pubSubConnection.get(), "pub/sub");
                log.info("Connected to Redis: {}", config.getRedisUrl());
                connectionSink.tryEmitNext(ConnectionEvent.open(System.currentTimeMillis()));
            })
            .onErrorMap(err -> !(err instanceof ChannelException),
                err -> new ChannelException("redis", ChannelException.Status.CHANNEL_ERROR,
                    "Failed to connect to " + config.getRedisUrl(), err))
            .then();
    }

    static void requireOpen(StatefulConnection<?, ?> conn, String name) {
        if (!conn.isOpen()) {
            throw new ChannelException("redis", ChannelException.Status.CLOSED,
                "Redis " + name + " connection is down");
        }
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
            StatefulRedisPubSubConnection<String, String> pubSub = pubSubConnection.getAndSet(null);
            if (pubSub != null) {
                pubSub.close();
            }
            StatefulRedisConnection<String, String> conn = connection.getAndSet(null);
            if (conn != null) {
                conn.close();
            }
            client.shutdown();
            connectionSink.tryEmitComplete();
            log.info("Redis backend closed");
        });
    }

    // ---------------------------------------------------------------- lifecycle listener

    @Override
    public void onRedisConnected(RedisChannelHandler<?, ?> handler, SocketAddress socketAddress) {
        log.info("Redis connection up: {}", socketAddress);
        connectionSink.tryEmitNext(ConnectionEvent.open(System.currentTimeMillis()));
    }

    @Override
    public void onRedisDisconnected(RedisChannelHandler<?, ?> handler) {
        log.warn("Redis connection lost");
        connectionSink.tryEmitNext(ConnectionEvent.close(System.currentTimeMillis()));
    }

    @Override
    public void onRedisExceptionCaught(RedisChannelHandler<?, ?> handler, Throwable cause) {
        log.warn("Redis connection error", cause);
        connectionSink.tryEmitNext(ConnectionEvent.error(cause, System.currentTimeMillis()));
    }

    @Override
    public Flux<ConnectionEvent> connectionEvents() {
        return connectionSink.asFlux();
    }

    // ---------------------------------------------------------------- channels

    @Override
    public ChannelHandle<TableChange> tableChannel(String table, String filter, String event) {
        RowFilter rowFilter = RowFilter.parse(filter);
        return new PubSubHandle<>(Keys.tableChannel(table),
            payload -> JsonUtils.readValue(payload, TableChange.class),
            change -> matchesEvent(event, change.getType().name()) && rowFilter.matches(change.affectedRow()));
    }

    @Override
    public ChannelHandle<BroadcastMessage> broadcastChannel(String channel, String event) {
        return new PubSubHandle<>(Keys.broadcastChannel(channel),
            payload -> JsonUtils.readValue(payload, BroadcastMessage.class),
            message -> matchesEvent(event, message.getEvent()));
    }

    @Override
    public PresenceHandle presenceChannel(String channel, String presenceKey) {
        return new RedisPresenceHandle(channel, presenceKey);
    }

    private static boolean matchesEvent(String wanted, String actual) {
        return wanted == null || "*".equals(wanted) || wanted.equalsIgnoreCase(actual);
    }

    @Override
    public Mono<Void> publish(String channel, String event, JsonNode payload) {
        BroadcastMessage message = BroadcastMessage.builder()
            .channel(channel)
            .event(event)
            .payload(payload)
            .sentAt(System.currentTimeMillis())
            .build();
        return commands().publish(Keys.broadcastChannel(channel), JsonUtils.writeValueAsString(message))
            .then()
            .doOnError(err -> log.error("Failed to publish {} on {}", event, channel, err));
    }

    @Override
    public Mono<JsonNode> rpc(String function, Map<String, Object> params) {
        return commands().<String>fcall(function, ScriptOutputType.VALUE, new String[0],
                JsonUtils.writeValueAsString(params))
            .next()
            .map(JsonUtils::readTree)
            .doOnError(err -> log.error("RPC {} failed", function, err));
    }

    private RedisReactiveCommands<String, String> commands() {
        StatefulRedisConnection<String, String> conn = connection.get();
        if (conn == null) {
            throw new ChannelException("redis", ChannelException.Status.CLOSED, "Redis backend not connected");
        }
        return conn.reactive();
    }

    private RedisPubSubReactiveCommands<String, String> pubSub() {
        StatefulRedisPubSubConnection<String, String> conn = pubSubConnection.get();
        if (conn == null) {
            throw new ChannelException("redis", ChannelException.Status.CLOSED, "Redis backend not connected");
        }
        return conn.reactive();
    }

    private Mono<Void> subscribeChannel(String redisChannel) {
        return Mono.defer(() -> {
            int refs = channelRefs.computeIfAbsent(redisChannel, k -> new AtomicInteger()).incrementAndGet();
            if (refs > 1) {
                return Mono.empty();
            }
            return pubSub().subscribe(redisChannel)
                .timeout(SUBSCRIBE_TIMEOUT)
                .onErrorMap(err -> {
                    channelRefs.computeIfPresent(redisChannel, (k, v) -> v.decrementAndGet() <= 0 ? null : v);
                    ChannelException.Status status = err instanceof TimeoutException
                        ? ChannelException.Status.TIMED_OUT
                        : ChannelException.Status.CHANNEL_ERROR;
                    return new ChannelException(redisChannel, status, "Failed to subscribe " + redisChannel, err);
                });
        });
    }

    private Mono<Void> unsubscribeChannel(String redisChannel) {
        return Mono.defer(() -> {
            AtomicInteger refs = channelRefs.get(redisChannel);
            if (refs == null || refs.decrementAndGet() > 0) {
                return Mono.empty();
            }
            channelRefs.remove(redisChannel);
            return pubSub().unsubscribe(redisChannel);
        });
    }

    private Flux<String> messages(String redisChannel) {
        return pubSub().observeChannels()
            .filter(message -> redisChannel.equals(message.getChannel()))
            .map(ChannelMessage::getMessage);
    }

    /**
     * Handle for table and broadcast channels.
     */
    private final class PubSubHandle<E> implements ChannelHandle<E> {
        private final String redisChannel;
        private final AtomicBoolean joined = new AtomicBoolean();
        private final Function<String, E> decoder;
        private final Predicate<E> accept;

        PubSubHandle(String redisChannel, Function<String, E> decoder, Predicate<E> accept) {
            this.redisChannel = redisChannel;
            this.decoder = decoder;
            this.accept = accept;
        }

        @Override
        public String name() {
            return redisChannel;
        }

        @Override
        public Mono<Void> subscribe() {
            return subscribeChannel(redisChannel).doOnSuccess(v -> joined.set(true));
        }

        @Override
        public Flux<E> events() {
            return messages(redisChannel)
                .concatMap(payload -> {
                    try {
                        return Mono.just(decoder.apply(payload));
                    } catch (RuntimeException e) {
                        log.warn("Undecodable message on {}", redisChannel, e);
                        return Mono.<E>empty();
                    }
                })
                .filter(accept);
        }

        @Override
        public Mono<Void> unsubscribe() {
            return Mono.defer(() -> joined.compareAndSet(true, false)
                ? unsubscribeChannel(redisChannel)
                : Mono.empty());
        }
    }

    /**
     * Presence handle: records live in {@code presence:<channel>}, diffs on {@code rt:presence:<channel>}.
     */
    private final class RedisPresenceHandle implements PresenceHandle {
        private final String channel;
        private final String presenceKey;
        private final String redisChannel;
        private final AtomicBoolean joined = new AtomicBoolean();

        RedisPresenceHandle(String channel, String presenceKey) {
            this.channel = channel;
            this.presenceKey = presenceKey;
            this.redisChannel = Keys.presenceChannel(channel);
        }

        @Override
        public String name() {
            return redisChannel;
        }

        @Override
        public Mono<Void> subscribe() {
            return subscribeChannel(redisChannel).doOnSuccess(v -> joined.set(true));
        }

        @Override
        public Flux<PresenceSignal> events() {
            Mono<PresenceSignal> initialSync = commands().hgetall(Keys.presence(channel))
                .collectMap(KeyValue::getKey, kv -> decodeRecords(kv.getValue()))
                .flatMap(this::pruneStale)
                .map(PresenceSignal::sync);

            Flux<PresenceSignal> diffs = messages(redisChannel)
                .map(payload -> JsonUtils.readValue(payload, PresenceSignal.class));

            return initialSync.concatWith(diffs);
        }

        /**
         * Deletes the entries of sessions that stopped heartbeating and returns the rest.
         */
        private Mono<Map<String, List<PresenceRecord>>> pruneStale(Map<String, List<PresenceRecord>> state) {
            Map<String, List<PresenceRecord>> live = PresenceExpiry.live(state, System.currentTimeMillis(),
                config.getPresenceStaleAfter().toMillis());
            String[] stale = state.keySet().stream()
                .filter(key -> !live.containsKey(key))
                .toArray(String[]::new);
            if (stale.length == 0) {
                return Mono.just(live);
            }
            log.info("Removing {} stale presence entries from {}", stale.length, channel);
            return commands().hdel(Keys.presence(channel), stale)
                .onErrorResume(err -> {
                    log.warn("Failed to remove stale presence entries from {}", channel, err);
                    return Mono.empty();
                })
                .thenReturn(live);
        }

        @Override
        public Mono<Void> track(PresenceRecord record) {
            List<PresenceRecord> records = List.of(record);
            return commands().hset(Keys.presence(channel), presenceKey, JsonUtils.writeValueAsString(records))
                .then(commands().publish(redisChannel,
                    JsonUtils.writeValueAsString(PresenceSignal.join(presenceKey, records))))
                .then();
        }

        @Override
        public Mono<Void> untrack() {
            return commands().hget(Keys.presence(channel), presenceKey)
                .map(RedisRealtimeBackend::decodeRecords)
                .defaultIfEmpty(List.of())
                .flatMap(records -> commands().hdel(Keys.presence(channel), presenceKey)
                    .then(commands().publish(redisChannel,
                        JsonUtils.writeValueAsString(PresenceSignal.leave(presenceKey, records)))))
                .then();
        }

        @Override
        public Mono<Void> unsubscribe() {
            return Mono.defer(() -> joined.compareAndSet(true, false)
                ? unsubscribeChannel(redisChannel)
                : Mono.empty());
        }
    }

    private static List<PresenceRecord> decodeRecords(String json) {
        return JsonUtils.readValue(json, new TypeReference<List<PresenceRecord>>() {
        });
    }
}
