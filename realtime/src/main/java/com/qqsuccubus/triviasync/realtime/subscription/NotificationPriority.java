package com.qqsuccubus.triviasync.realtime.subscription;

/**
 * Replay order of queued host notifications: lower rank first.
 */
public enum NotificationPriority {
    URGENT(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int rank;

    NotificationPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
