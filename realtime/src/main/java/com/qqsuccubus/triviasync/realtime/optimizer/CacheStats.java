package com.qqsuccubus.triviasync.realtime.optimizer;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    int size;
    int capacity;
    long hits;
    long misses;
    long evictions;
    double hitRate;
}
