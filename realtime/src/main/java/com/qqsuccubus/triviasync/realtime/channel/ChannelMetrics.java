package com.qqsuccubus.triviasync.realtime.channel;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChannelMetrics {
    int totalSubscriptions;
    int activeSubscriptions;
    double averageLatencyMs;
    /**
     * Transport errors seen since start.
     */
    int connectionAttempts;
    /**
     * Epoch millis of the last transport OPEN that triggered resubscription, 0 if none.
     */
    long lastReconnectTime;
    long eventCount;
}
