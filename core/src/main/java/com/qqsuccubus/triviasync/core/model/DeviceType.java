package com.qqsuccubus.triviasync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Device class derived from the user agent.
 */
public enum DeviceType {
    DESKTOP("desktop"),
    MOBILE("mobile"),
    TABLET("tablet");

    private final String wireName;

    DeviceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
