package com.qqsuccubus.triviasync.realtime.channel;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TableOptions {
    /**
     * INSERT, UPDATE, DELETE or {@code *}.
     */
    @Builder.Default
    String event = "*";
    /**
     * Row filter, e.g. {@code room_id=eq.42}.
     */
    String filter;
    /**
     * Explicit subscription id; derived from kind, table and time when absent.
     */
    String id;
}
