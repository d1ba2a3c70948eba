package com.qqsuccubus.triviasync.realtime.state;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder
@With
public class SyncOptions {
    @Builder.Default
    ResolutionStrategy strategy = ResolutionStrategy.LATEST_TIMESTAMP;
    /**
     * Keep the local state whatever the strategy says.
     */
    boolean forceLocal;
    /**
     * Keep the remote state whatever the strategy says.
     */
    boolean forceRemote;
    /**
     * Replay a sync that was rejected while this one was in flight, once, with the latest state.
     */
    boolean followUp;

    public static SyncOptions defaults() {
        return SyncOptions.builder().build();
    }
}
