package com.qqsuccubus.triviasync.realtime.channel;

/**
 * Lifecycle of a {@link ChannelSubscription}.
 * <p>
 * CREATED -> SUBSCRIBING -> ACTIVE, ACTIVE -> INACTIVE on transport close,
 * INACTIVE -> SUBSCRIBING on reconnect, any -> REMOVED on unsubscribe.
 * </p>
 */
public enum SubscriptionState {
    CREATED,
    SUBSCRIBING,
    ACTIVE,
    INACTIVE,
    REMOVED
}
