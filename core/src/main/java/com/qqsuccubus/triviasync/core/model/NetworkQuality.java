package com.qqsuccubus.triviasync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Network quality classification shared by presence records and the performance optimizer.
 */
public enum NetworkQuality {
    EXCELLENT("excellent"),
    GOOD("good"),
    POOR("poor"),
    CRITICAL("critical"),
    OFFLINE("offline");

    private final String wireName;

    NetworkQuality(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
