package com.qqsuccubus.triviasync.realtime.redis;

import com.qqsuccubus.triviasync.core.model.GameState;
import com.qqsuccubus.triviasync.core.redis.Keys;
import com.qqsuccubus.triviasync.core.util.JsonUtils;
import com.qqsuccubus.triviasync.realtime.backend.RemoteSnapshot;
import com.qqsuccubus.triviasync.realtime.backend.RemoteStateStore;
import com.qqsuccubus.triviasync.realtime.backend.StateStoreException;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Game state snapshots stored as Redis hashes under {@link Keys#state(String)}.
 */
public class RedisStateStore implements RemoteStateStore, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisStateStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisStateStore(SyncConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("State store connected to Redis: {}", config.getRedisUrl());
    }

    @Override
    public Mono<RemoteSnapshot> read(String entityId) {
        return commands.hgetall(Keys.state(entityId))
            .collectMap(KeyValue::getKey, KeyValue::getValue)
            .filter(fields -> fields.containsKey("state"))
            .map(RedisStateStore::toSnapshot)
            .onErrorMap(err -> !(err instanceof StateStoreException),
                err -> new StateStoreException("Failed to read state of " + entityId, err));
    }

    @Override
    public Mono<Void> update(String entityId, GameState state, long version, long timestamp, String clientId) {
        Map<String, String> fields = Map.of(
            "state", JsonUtils.writeValueAsString(state),
            "version", String.valueOf(version),
            "timestamp", String.valueOf(timestamp),
            "clientId", clientId);
        return commands.hset(Keys.state(entityId), fields)
            .doOnSuccess(n -> log.debug("Stored {} version {}", entityId, version))
            .onErrorMap(err -> new StateStoreException("Failed to write state of " + entityId, err))
            .then();
    }

    private static RemoteSnapshot toSnapshot(Map<String, String> fields) {
        try {
            return RemoteSnapshot.builder()
                .state(JsonUtils.readValue(fields.get("state"), GameState.class))
                .version(Long.parseLong(fields.getOrDefault("version", "0")))
                .timestamp(Long.parseLong(fields.getOrDefault("timestamp", "0")))
                .clientId(fields.get("clientId"))
                .build();
        } catch (RuntimeException e) {
            throw new StateStoreException("Corrupt state snapshot", e);
        }
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
    }
}
