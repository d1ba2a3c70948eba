package com.qqsuccubus.triviasync.realtime.subscription;

import com.qqsuccubus.triviasync.core.msg.BroadcastMessage;
import com.qqsuccubus.triviasync.core.msg.TableChange;
import lombok.Builder;
import lombok.Value;

import java.util.function.Consumer;

@Value
@Builder
public class TeamSubscriptionOptions {
    String teamId;
    Consumer<TableChange> onAnswer;
    Consumer<BroadcastMessage> onReview;
    Consumer<TableChange> onMemberChange;
    Consumer<BroadcastMessage> onStatus;
}
