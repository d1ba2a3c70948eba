package com.qqsuccubus.triviasync.realtime.subscription;

import com.qqsuccubus.triviasync.core.msg.BroadcastMessage;
import com.qqsuccubus.triviasync.core.msg.TableChange;
import lombok.Builder;
import lombok.Value;

import java.util.function.Consumer;

/**
 * Handlers for a room group. Only channels with a handler are subscribed.
 */
@Value
@Builder
public class RoomSubscriptionOptions {
    String roomId;
    Consumer<TableChange> onGameStateChange;
    Consumer<TableChange> onTeamsChange;
    Consumer<BroadcastMessage> onQuestion;
    Consumer<BroadcastMessage> onTimer;
    Consumer<BroadcastMessage> onLeaderboard;
}
