package com.qqsuccubus.triviasync.realtime.presence;

public enum PresenceEventType {
    USER_JOINED,
    USER_LEFT,
    STATUS_CHANGED,
    ACTIVITY_CHANGED,
    PRESENCE_SYNCED
}
