package com.qqsuccubus.triviasync.realtime.optimizer;

import com.qqsuccubus.triviasync.core.model.NetworkQuality;

import java.time.Duration;

/**
 * How aggressively the optimizer trades freshness for bandwidth.
 */
public enum OptimizationLevel {
    LOW(Duration.ofMillis(100), 50, Duration.ofMinutes(5)),
    MEDIUM(Duration.ofMillis(200), 30, Duration.ofMinutes(10)),
    HIGH(Duration.ofMillis(300), 20, Duration.ofMinutes(15)),
    AGGRESSIVE(Duration.ofMillis(500), 10, Duration.ofMinutes(30));

    public static final Duration THROTTLE_WINDOW = Duration.ofSeconds(1);

    private final Duration debounceDelay;
    private final int throttleLimit;
    private final Duration cacheTtl;

    OptimizationLevel(Duration debounceDelay, int throttleLimit, Duration cacheTtl) {
        this.debounceDelay = debounceDelay;
        this.throttleLimit = throttleLimit;
        this.cacheTtl = cacheTtl;
    }

    public Duration debounceDelay() {
        return debounceDelay;
    }

    public int throttleLimit() {
        return throttleLimit;
    }

    public Duration cacheTtl() {
        return cacheTtl;
    }

    public static OptimizationLevel recommendedFor(NetworkQuality quality) {
        return switch (quality) {
            case EXCELLENT -> LOW;
            case GOOD -> MEDIUM;
            case POOR -> HIGH;
            case CRITICAL, OFFLINE -> AGGRESSIVE;
        };
    }
}
