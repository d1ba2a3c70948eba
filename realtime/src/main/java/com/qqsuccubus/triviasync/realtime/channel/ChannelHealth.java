package com.qqsuccubus.triviasync.realtime.channel;

import lombok.Value;

@Value
public class ChannelHealth {
    String id;
    SubscriptionKind kind;
    SubscriptionState state;
    boolean active;
    long lastActivity;
    int connectionAttempts;
}
