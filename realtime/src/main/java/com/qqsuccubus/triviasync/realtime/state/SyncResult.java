package com.qqsuccubus.triviasync.realtime.state;

import com.qqsuccubus.triviasync.core.model.GameState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncResult {
    boolean success;
    SyncOutcome outcome;
    /**
     * State after the sync; null when skipped or failed.
     */
    GameState state;
    long version;
    StateConflict conflict;
    String error;
    long timestamp;

    static SyncResult skipped(long timestamp) {
        return SyncResult.builder()
            .success(false)
            .outcome(SyncOutcome.SKIPPED)
            .error("Sync already in progress")
            .timestamp(timestamp)
            .build();
    }

    static SyncResult failed(Throwable error, long timestamp) {
        return SyncResult.builder()
            .success(false)
            .outcome(SyncOutcome.FAILED)
            .error(error.getMessage())
            .timestamp(timestamp)
            .build();
    }
}
