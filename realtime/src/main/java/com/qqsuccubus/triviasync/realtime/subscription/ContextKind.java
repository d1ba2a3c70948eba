package com.qqsuccubus.triviasync.realtime.subscription;

public enum ContextKind {
    ROOM("room"),
    TEAM("team"),
    HOST("host");

    private final String prefix;

    ContextKind(String prefix) {
        this.prefix = prefix;
    }

    /**
     * @return group id for a context, e.g. {@code room-42}
     */
    public String groupId(String contextId) {
        return prefix + "-" + contextId;
    }
}
