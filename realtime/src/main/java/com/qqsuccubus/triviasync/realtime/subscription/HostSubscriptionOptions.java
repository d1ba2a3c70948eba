package com.qqsuccubus.triviasync.realtime.subscription;

import lombok.Builder;
import lombok.Value;

import java.util.function.Consumer;

/**
 * Handlers for a host group. Queued notifications are replayed through the same handlers.
 */
@Value
@Builder
public class HostSubscriptionOptions {
    String hostId;
    String roomId;
    Consumer<QueuedNotification> onAnswerReview;
    Consumer<QueuedNotification> onGameControl;
    Consumer<QueuedNotification> onAdmin;
    Consumer<QueuedNotification> onEmergency;

    Consumer<QueuedNotification> handlerFor(NotificationType type) {
        return switch (type) {
            case ANSWER_REVIEW -> onAnswerReview;
            case GAME_CONTROL -> onGameControl;
            case ADMIN -> onAdmin;
            case EMERGENCY -> onEmergency;
        };
    }
}
