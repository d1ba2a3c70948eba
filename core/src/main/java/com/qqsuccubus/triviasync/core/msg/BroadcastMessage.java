package com.qqsuccubus.triviasync.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Message published on a broadcast channel.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BroadcastMessage {
    String channel;
    /**
     * Application event name, e.g. {@code "question_started"}.
     */
    String event;
    JsonNode payload;
    /**
     * Epoch millis when the sender published the message.
     */
    long sentAt;
}
