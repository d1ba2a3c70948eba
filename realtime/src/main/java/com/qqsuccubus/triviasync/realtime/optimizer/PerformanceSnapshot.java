package com.qqsuccubus.triviasync.realtime.optimizer;

import com.qqsuccubus.triviasync.core.model.NetworkQuality;
import lombok.Builder;
import lombok.Value;

/**
 * Rolling performance figures published after each collection interval.
 */
@Value
@Builder
public class PerformanceSnapshot {
    long timestamp;

    double averageLatencyMs;
    double minLatencyMs;
    double maxLatencyMs;
    double p95LatencyMs;
    double p99LatencyMs;

    double eventsPerSecond;
    double peakEventsPerSecond;
    long debouncedEvents;
    long throttledEvents;
    double dropRate;

    int cacheSize;
    double cacheHitRate;

    NetworkQuality networkQuality;
    OptimizationLevel optimizationLevel;
    double healthScore;
}
