package com.qqsuccubus.triviasync.realtime.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * Notification addressed to a host, delivered live or replayed from the host queue.
 */
@Value
@Builder(toBuilder = true)
public class QueuedNotification {

    /**
     * Replay order: priority rank, then oldest first.
     */
    public static final Comparator<QueuedNotification> REPLAY_ORDER = Comparator
        .comparingInt((QueuedNotification n) -> n.getPriority().rank())
        .thenComparingLong(QueuedNotification::getTimestamp);

    String id;
    NotificationType type;
    String event;
    JsonNode payload;
    long timestamp;
    NotificationPriority priority;
    String hostId;
    String roomId;
}
