package com.qqsuccubus.triviasync.realtime.state;

import com.qqsuccubus.triviasync.core.hash.Checksums;
import com.qqsuccubus.triviasync.core.model.GameState;
import lombok.Value;

/**
 * Versioned snapshot of a game state.
 */
@Value
public class StateVersion {
    long version;
    GameState state;
    long timestamp;
    String clientId;
    String hash;

    public static StateVersion of(long version, GameState state, long timestamp, String clientId) {
        return new StateVersion(version, state, timestamp, clientId, contentHash(state));
    }

    /**
     * SHA-256 over the fields that identify where a game is: phase, round, question, flags,
     * last update and roster sizes.
     */
    public static String contentHash(GameState state) {
        if (state == null) {
            return Checksums.sha256Hex("null");
        }
        String content = String.join("|",
            state.getPhase() == null ? "" : state.getPhase().wireName(),
            String.valueOf(state.getCurrentRound()),
            state.getCurrentQuestion() == null ? "" : String.valueOf(state.getCurrentQuestion().getId()),
            String.valueOf(state.isActive()),
            String.valueOf(state.isPaused()),
            String.valueOf(state.getLastUpdated()),
            String.valueOf(state.getPlayers().size()),
            String.valueOf(state.getTeams().size()));
        return Checksums.sha256Hex(content);
    }
}
