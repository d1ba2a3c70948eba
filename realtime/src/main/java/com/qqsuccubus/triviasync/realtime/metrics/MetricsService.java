package com.qqsuccubus.triviasync.realtime.metrics;

import com.qqsuccubus.triviasync.core.metrics.MetricsNames;
import com.qqsuccubus.triviasync.core.metrics.MetricsTags;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics service for the sync layer.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String clientId;

    // Counters
    private final Counter resubscribeSuccess;
    private final Counter resubscribeFailure;
    private final Counter heartbeatSuccess;
    private final Counter heartbeatFailure;
    private final Counter hostQueued;
    private final Counter hostDropped;
    private final Counter hostReplayed;

    // Timers
    private final Timer dispatchLatency;
    private final Timer syncLatency;

    public MetricsService(MeterRegistry registry, SyncConfig config) {
        this.registry = registry;
        this.clientId = config.getClientId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        resubscribeSuccess = Counter.builder(MetricsNames.CHANNEL_RESUBSCRIBE_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.OUTCOME, "success")
            .description("Subscriptions restored after a transport reconnect")
            .register(registry);

        resubscribeFailure = Counter.builder(MetricsNames.CHANNEL_RESUBSCRIBE_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.OUTCOME, "failure")
            .description("Subscriptions that could not be restored after retries")
            .register(registry);

        heartbeatSuccess = Counter.builder(MetricsNames.PRESENCE_HEARTBEATS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.OUTCOME, "success")
            .register(registry);

        heartbeatFailure = Counter.builder(MetricsNames.PRESENCE_HEARTBEATS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.OUTCOME, "failure")
            .register(registry);

        hostQueued = Counter.builder(MetricsNames.HOST_NOTIFICATIONS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.REASON, "queued")
            .description("Host notifications queued while the host was not subscribed")
            .register(registry);

        hostDropped = Counter.builder(MetricsNames.HOST_NOTIFICATIONS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.REASON, "dropped")
            .description("Queued host notifications dropped because the queue was full")
            .register(registry);

        hostReplayed = Counter.builder(MetricsNames.HOST_NOTIFICATIONS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.REASON, "replayed")
            .register(registry);

        // Listener time is usually tiny; objectives cover slow UI handlers
        dispatchLatency = Timer.builder(MetricsNames.CHANNEL_DISPATCH_LATENCY)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Listener execution time per dispatched event")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                Duration.ofMillis(16),
                Duration.ofMillis(50),
                Duration.ofMillis(100)
            )
            .register(registry);

        syncLatency = Timer.builder(MetricsNames.SYNC_LATENCY)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Read-resolve-write round trip of a state sync")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(250),
                Duration.ofMillis(500),
                Duration.ofMillis(1000),
                Duration.ofMillis(5000)
            )
            .register(registry);
    }

    /**
     * Records one event delivered to a subscription listener.
     *
     * @param kind        subscription kind wire name
     * @param listenerNanos time spent in the listener
     */
    public void recordChannelEvent(String kind, long listenerNanos) {
        Counter.builder(MetricsNames.CHANNEL_EVENTS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.KIND, kind)
            .register(registry)
            .increment();
        dispatchLatency.record(Duration.ofNanos(listenerNanos));
    }

    public void recordResubscribe(boolean success) {
        if (success) {
            resubscribeSuccess.increment();
        } else {
            resubscribeFailure.increment();
        }
    }

    public void recordConnectionEvent(String type) {
        Counter.builder(MetricsNames.CONNECTION_EVENTS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.TYPE, type)
            .register(registry)
            .increment();
    }

    public void recordHeartbeat(boolean success) {
        if (success) {
            heartbeatSuccess.increment();
        } else {
            heartbeatFailure.increment();
        }
    }

    public void recordHostNotificationQueued() {
        hostQueued.increment();
    }

    public void recordHostNotificationDropped() {
        hostDropped.increment();
    }

    public void recordHostNotificationsReplayed(int count) {
        hostReplayed.increment(count);
    }

    /**
     * @param outcome clean, resolved, skipped or failed
     */
    public void recordSync(String outcome) {
        Counter.builder(MetricsNames.SYNC_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.OUTCOME, outcome)
            .register(registry)
            .increment();
    }

    public void recordSyncLatency(long startNanos) {
        syncLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordConflict(String type) {
        Counter.builder(MetricsNames.SYNC_CONFLICTS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.TYPE, type)
            .register(registry)
            .increment();
    }

    /**
     * @param type debounced, throttled, cache_hit, cache_miss, cache_evicted or conflict_resolved
     */
    public void recordOptimizerEvent(String type) {
        Counter.builder(MetricsNames.OPTIMIZER_EVENTS_TOTAL)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .tag(MetricsTags.TYPE, type)
            .register(registry)
            .increment();
    }

    public void registerActiveChannelsGauge(Supplier<Number> activeChannels) {
        Gauge.builder(MetricsNames.CHANNEL_ACTIVE, activeChannels)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .description("Subscriptions currently active")
            .register(registry);
    }

    public void registerPresenceSessionsGauge(Supplier<Number> sessions) {
        Gauge.builder(MetricsNames.PRESENCE_SESSIONS, sessions)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .register(registry);
    }

    public void registerCacheSizeGauge(Supplier<Number> cacheSize) {
        Gauge.builder(MetricsNames.OPTIMIZER_CACHE_SIZE, cacheSize)
            .tag(MetricsTags.CLIENT_ID, clientId)
            .register(registry);
    }
}
