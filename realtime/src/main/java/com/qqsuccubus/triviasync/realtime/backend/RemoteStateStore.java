package com.qqsuccubus.triviasync.realtime.backend;

import com.qqsuccubus.triviasync.core.model.GameState;
import reactor.core.publisher.Mono;

/**
 * Authoritative store for versioned game state.
 * <p>
 * Failures are signalled as {@link StateStoreException}.
 * </p>
 */
public interface RemoteStateStore {

    /**
     * @param entityId Game state id
     * @return latest snapshot, or empty if nothing was written yet
     */
    Mono<RemoteSnapshot> read(String entityId);

    Mono<Void> update(String entityId, GameState state, long version, long timestamp, String clientId);
}
