package com.qqsuccubus.triviasync.core.redis;

/**
 * Redis keyspace used by the Redis-backed realtime backend and state store.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions ({@code state:}, {@code presence:}, {@code rt:})</li>
 *   <li>Hashes for structured data, pub/sub channels for events</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Game state snapshot: {@code state:{entityId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b>
     * <ul>
     *   <li>{@code state}: JSON-encoded game state</li>
     *   <li>{@code version}: Monotonic version written by the last synchronizer</li>
     *   <li>{@code timestamp}: Epoch millis of the last write</li>
     *   <li>{@code clientId}: Client that performed the last write</li>
     * </ul>
     * </p>
     *
     * @param entityId Game state identifier
     * @return Redis key
     */
    public static String state(String entityId) {
        return "state:" + entityId;
    }

    /**
     * Presence members of a channel: {@code presence:{channel}}
     * <p>
     * <b>Type:</b> Hash, field = presence key, value = JSON array of presence records.
     * </p>
     *
     * @param channelName Presence channel name
     * @return Redis key
     */
    public static String presence(String channelName) {
        return "presence:" + channelName;
    }

    /**
     * Pub/sub channel carrying row changes of a table: {@code rt:table:{table}}
     *
     * @param table Table name
     * @return Redis channel
     */
    public static String tableChannel(String table) {
        return "rt:table:" + table;
    }

    /**
     * Pub/sub channel carrying broadcast messages: {@code rt:broadcast:{channel}}
     *
     * @param channelName Broadcast channel name
     * @return Redis channel
     */
    public static String broadcastChannel(String channelName) {
        return "rt:broadcast:" + channelName;
    }

    /**
     * Pub/sub channel carrying presence join/leave diffs: {@code rt:presence:{channel}}
     *
     * @param channelName Presence channel name
     * @return Redis channel
     */
    public static String presenceChannel(String channelName) {
        return "rt:presence:" + channelName;
    }

}
