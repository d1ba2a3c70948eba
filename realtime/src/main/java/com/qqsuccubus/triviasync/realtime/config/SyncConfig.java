package com.qqsuccubus.triviasync.realtime.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the realtime sync layer, loaded from environment variables.
 * <p>
 * Every field has a default, so tests can build a config with only the values they care about.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class SyncConfig {

    @Builder.Default
    String clientId = "trivia-client";
    @Builder.Default
    String redisUrl = "redis://localhost:6379";

    // Channels
    @Builder.Default
    int subscriptionBufferSize = 256;
    @Builder.Default
    int channelLatencyWindow = 100;
    @Builder.Default
    int maxResubscribeRetries = 5;
    @Builder.Default
    int maxReconnectAttempts = 10;

    // Presence
    @Builder.Default
    Duration heartbeatInterval = Duration.ofSeconds(30);
    @Builder.Default
    Duration awayAfter = Duration.ofMinutes(5);
    @Builder.Default
    Duration offlineAfter = Duration.ofMinutes(30);
    // Records not refreshed for this long are left out of presence syncs
    @Builder.Default
    Duration presenceStaleAfter = Duration.ofSeconds(90);

    // Subscriptions
    @Builder.Default
    int hostQueueCapacity = 100;
    @Builder.Default
    Duration leaderboardCacheTtl = Duration.ofSeconds(30);

    // State sync
    @Builder.Default
    int historyCapacity = 50;
    @Builder.Default
    int syncMaxRetries = 3;
    @Builder.Default
    Duration syncRetryBase = Duration.ofSeconds(1);
    @Builder.Default
    Duration syncRetryJitter = Duration.ofMillis(250);
    @Builder.Default
    Duration concurrentWindow = Duration.ofSeconds(1);

    // Optimizer
    @Builder.Default
    int cacheCapacity = 1000;
    @Builder.Default
    Duration cacheDefaultTtl = Duration.ofMinutes(5);
    @Builder.Default
    int deltaBufferCapacity = 500;
    @Builder.Default
    Duration deltaFlushInterval = Duration.ofSeconds(1);
    @Builder.Default
    Duration metricsInterval = Duration.ofSeconds(5);
    @Builder.Default
    int latencyWindow = 1000;
    @Builder.Default
    boolean adaptiveOptimization = true;

    public static SyncConfig fromEnv() {
        return SyncConfig.builder()
                .clientId(getEnv("CLIENT_ID", "trivia-client"))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .subscriptionBufferSize(Integer.parseInt(getEnv("SUBSCRIPTION_BUFFER_SIZE", "256")))
                .maxReconnectAttempts(Integer.parseInt(getEnv("MAX_RECONNECT_ATTEMPTS", "10")))
                .heartbeatInterval(Duration.ofSeconds(Long.parseLong(getEnv("HEARTBEAT_INTERVAL_SEC", "30"))))
                .awayAfter(Duration.ofSeconds(Long.parseLong(getEnv("AWAY_AFTER_SEC", "300"))))
                .offlineAfter(Duration.ofSeconds(Long.parseLong(getEnv("OFFLINE_AFTER_SEC", "1800"))))
                .presenceStaleAfter(Duration.ofSeconds(Long.parseLong(getEnv("PRESENCE_STALE_AFTER_SEC", "90"))))
                .hostQueueCapacity(Integer.parseInt(getEnv("HOST_QUEUE_CAPACITY", "100")))
                .historyCapacity(Integer.parseInt(getEnv("HISTORY_CAPACITY", "50")))
                .syncMaxRetries(Integer.parseInt(getEnv("SYNC_MAX_RETRIES", "3")))
                .cacheCapacity(Integer.parseInt(getEnv("CACHE_CAPACITY", "1000")))
                .deltaBufferCapacity(Integer.parseInt(getEnv("DELTA_BUFFER_CAPACITY", "500")))
                .metricsInterval(Duration.ofMillis(Long.parseLong(getEnv("METRICS_INTERVAL_MS", "5000"))))
                .adaptiveOptimization(Boolean.parseBoolean(getEnv("ADAPTIVE_OPTIMIZATION", "true")))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
