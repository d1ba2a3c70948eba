package com.qqsuccubus.triviasync.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Question currently shown to the room.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ActiveQuestion {
    String id;
    int roundNumber;
    int questionNumber;
    /**
     * Epoch millis when the question was displayed.
     */
    long startedAt;
}
