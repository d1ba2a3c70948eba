package com.qqsuccubus.triviasync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a participant in a room.
 */
public enum PresenceRole {
    HOST("host"),
    PLAYER("player"),
    SPECTATOR("spectator"),
    GUEST("guest");

    private final String wireName;

    PresenceRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
