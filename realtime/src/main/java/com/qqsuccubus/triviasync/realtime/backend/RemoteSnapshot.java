package com.qqsuccubus.triviasync.realtime.backend;

import com.qqsuccubus.triviasync.core.model.GameState;
import lombok.Builder;
import lombok.Value;

/**
 * Game state as last written to the authoritative store.
 */
@Value
@Builder
public class RemoteSnapshot {
    GameState state;
    long version;
    long timestamp;
    String clientId;
}
