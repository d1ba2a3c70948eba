package com.qqsuccubus.triviasync.core.metrics;

/**
 * Micrometer metric names used by the sync layer.
 * <p>
 * <b>Naming convention:</b> {@code trivia.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Events dispatched to subscription listeners.
     * <p>
     * Tags: kind (table-change/broadcast/presence)
     * </p>
     */
    public static final String CHANNEL_EVENTS_TOTAL = "trivia.channel.events.total";

    /**
     * Timer: Listener execution time per dispatched event.
     * <p>
     * Tags: kind
     * </p>
     */
    public static final String CHANNEL_DISPATCH_LATENCY = "trivia.channel.dispatch.latency";

    /**
     * Counter: Resubscribe attempts after a transport reconnect.
     * <p>
     * Tags: outcome (success/failure)
     * </p>
     */
    public static final String CHANNEL_RESUBSCRIBE_TOTAL = "trivia.channel.resubscribe.total";

    /**
     * Gauge: Subscriptions currently active.
     */
    public static final String CHANNEL_ACTIVE = "trivia.channel.active";

    /**
     * Counter: Transport lifecycle events.
     * <p>
     * Tags: type (open/close/error)
     * </p>
     */
    public static final String CONNECTION_EVENTS_TOTAL = "trivia.connection.events.total";

    /**
     * Counter: Host notifications queued while the host was away.
     * <p>
     * Tags: reason (queued/dropped/replayed)
     * </p>
     */
    public static final String HOST_NOTIFICATIONS_TOTAL = "trivia.subscription.host.notifications.total";

    /**
     * Gauge: Presence sessions joined from this client.
     */
    public static final String PRESENCE_SESSIONS = "trivia.presence.sessions";

    /**
     * Counter: Heartbeats sent.
     * <p>
     * Tags: outcome (success/failure)
     * </p>
     */
    public static final String PRESENCE_HEARTBEATS_TOTAL = "trivia.presence.heartbeats.total";

    /**
     * Counter: State sync attempts.
     * <p>
     * Tags: outcome (clean/resolved/skipped/failed)
     * </p>
     */
    public static final String SYNC_TOTAL = "trivia.sync.total";

    /**
     * Counter: State conflicts detected.
     * <p>
     * Tags: type (version/timestamp/concurrent)
     * </p>
     */
    public static final String SYNC_CONFLICTS_TOTAL = "trivia.sync.conflicts.total";

    /**
     * Timer: Full read-resolve-write sync round trip.
     */
    public static final String SYNC_LATENCY = "trivia.sync.latency";

    /**
     * Counter: Optimizer interventions.
     * <p>
     * Tags: type (debounced/throttled/cache_hit/delta_applied/conflict_resolved)
     * </p>
     */
    public static final String OPTIMIZER_EVENTS_TOTAL = "trivia.optimizer.events.total";

    /**
     * Gauge: Entries in the priority cache.
     */
    public static final String OPTIMIZER_CACHE_SIZE = "trivia.optimizer.cache.size";
}
