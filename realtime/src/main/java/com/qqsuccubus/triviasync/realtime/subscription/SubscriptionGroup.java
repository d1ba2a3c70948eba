package com.qqsuccubus.triviasync.realtime.subscription;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named channels subscribed together for one room, team or host.
 */
@Getter
public class SubscriptionGroup {

    private final String id;
    private final ContextKind contextKind;
    private final String contextId;
    /**
     * Channel name (e.g. {@code game_state}) -> channel subscription id, in creation order.
     */
    private final Map<String, String> channels;
    private final long createdAt;

    private volatile boolean active = true;
    private volatile long lastActivity;

    SubscriptionGroup(String id, ContextKind contextKind, String contextId, Map<String, String> channels, long createdAt) {
        this.id = id;
        this.contextKind = contextKind;
        this.contextId = contextId;
        this.channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    void touch(long now) {
        this.lastActivity = now;
    }

    void deactivate() {
        this.active = false;
    }
}
