package com.qqsuccubus.triviasync.realtime.channel;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BroadcastOptions {
    @Builder.Default
    String event = "*";
    String id;
}
