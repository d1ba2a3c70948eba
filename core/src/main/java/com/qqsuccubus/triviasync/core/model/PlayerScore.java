package com.qqsuccubus.triviasync.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Cumulative and per-round score of one player.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class PlayerScore {
    String playerId;
    String displayName;
    String teamId;
    int totalPoints;
    /**
     * Round number -> points earned in that round.
     */
    @Builder.Default
    Map<Integer, Integer> roundPoints = Map.of();
    /**
     * Epoch millis of the player's last scored action.
     */
    long lastActive;
}
