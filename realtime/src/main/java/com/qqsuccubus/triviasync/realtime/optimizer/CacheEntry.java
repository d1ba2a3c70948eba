package com.qqsuccubus.triviasync.realtime.optimizer;

import lombok.Value;
import lombok.With;

/**
 * Cached value with its bookkeeping. Higher {@code priority} survives eviction longer.
 */
@Value
@With
public class CacheEntry {
    Object data;
    long timestamp;
    long ttlMillis;
    long hits;
    int priority;

    boolean isExpired(long now) {
        return now - timestamp > ttlMillis;
    }

    /**
     * @return hits per millisecond of age, the secondary eviction key
     */
    double hitRate(long now) {
        return (double) hits / Math.max(1, now - timestamp);
    }
}
