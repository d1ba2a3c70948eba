package com.qqsuccubus.triviasync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Liveness status published with a presence record.
 */
public enum PresenceStatus {
    ONLINE("online"),
    AWAY("away"),
    BUSY("busy"),
    OFFLINE("offline"),
    IN_GAME("in_game"),
    READY("ready");

    private final String wireName;

    PresenceStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @return true for statuses counted as "online" in presence metrics
     */
    public boolean countsAsOnline() {
        return this != OFFLINE && this != READY;
    }
}
