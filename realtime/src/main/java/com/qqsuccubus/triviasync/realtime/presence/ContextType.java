package com.qqsuccubus.triviasync.realtime.presence;

public enum ContextType {
    ROOM("room"),
    TEAM("team"),
    GLOBAL("global");

    private final String wireName;

    ContextType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return presence channel of a context, e.g. {@code presence:room:42}
     */
    public String channel(String contextId) {
        return "presence:" + wireName + ":" + contextId;
    }
}
