package com.qqsuccubus.triviasync.realtime.subscription;

/**
 * Host notification categories, one host channel each.
 */
public enum NotificationType {
    ANSWER_REVIEW("review_notifications", "host-reviews:", NotificationPriority.MEDIUM),
    GAME_CONTROL("game_control", "host-control:", NotificationPriority.HIGH),
    ADMIN("admin", "host-admin:", NotificationPriority.LOW),
    EMERGENCY("emergency", "host-emergency:", NotificationPriority.URGENT);

    private final String channelName;
    private final String channelPrefix;
    private final NotificationPriority defaultPriority;

    NotificationType(String channelName, String channelPrefix, NotificationPriority defaultPriority) {
        this.channelName = channelName;
        this.channelPrefix = channelPrefix;
        this.defaultPriority = defaultPriority;
    }

    /**
     * @return name of the channel inside the host subscription group
     */
    public String channelName() {
        return channelName;
    }

    public String channel(String roomId) {
        return channelPrefix + roomId;
    }

    public NotificationPriority defaultPriority() {
        return defaultPriority;
    }
}
