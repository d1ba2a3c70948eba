package com.qqsuccubus.triviasync.realtime.channel;

public enum SubscriptionKind {
    TABLE_CHANGE("table-change"),
    BROADCAST("broadcast"),
    PRESENCE("presence");

    private final String wireName;

    SubscriptionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
