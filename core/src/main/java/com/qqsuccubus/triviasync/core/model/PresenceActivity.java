package com.qqsuccubus.triviasync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse activity a participant is engaged in.
 */
public enum PresenceActivity {
    LOBBY("lobby"),
    IN_GAME("in_game"),
    REVIEWING("reviewing"),
    BROWSING("browsing"),
    IDLE("idle");

    private final String wireName;

    PresenceActivity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
