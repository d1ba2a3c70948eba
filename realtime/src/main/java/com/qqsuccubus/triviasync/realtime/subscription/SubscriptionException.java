package com.qqsuccubus.triviasync.realtime.subscription;

/**
 * A subscription group could not be created; its partially created channels were removed.
 */
public class SubscriptionException extends RuntimeException {

    private final String groupId;

    public SubscriptionException(String groupId, String message, Throwable cause) {
        super(message, cause);
        this.groupId = groupId;
    }

    public String getGroupId() {
        return groupId;
    }
}
