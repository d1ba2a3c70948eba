package com.qqsuccubus.triviasync.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Presence of one session in a room or team context.
 * <p>
 * Created on join, refreshed by heartbeats and activity, removed on leave. The
 * {@code sessionId} identifies the record; a user with two tabs has two records.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class PresenceRecord {
    String sessionId;
    String userId;
    String username;
    String displayName;
    String avatarUrl;
    PresenceRole role;
    PresenceStatus status;
    PresenceActivity currentActivity;
    String teamId;
    String teamName;
    String gameRoomId;
    /**
     * Epoch millis of the join.
     */
    long joinedAt;
    /**
     * Epoch millis of the last heartbeat or update.
     */
    long lastSeen;
    DeviceInfo deviceInfo;
    NetworkQuality networkQuality;
}
