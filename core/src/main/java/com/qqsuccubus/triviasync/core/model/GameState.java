package com.qqsuccubus.triviasync.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Shared game state of one trivia room.
 * <p>
 * Fields with a dedicated merge rule are typed; anything else the host application wants to
 * share lives in {@link #attributes}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class GameState {
    String id;
    String roomId;
    String hostId;

    GamePhase phase;
    int currentRound;
    ActiveQuestion currentQuestion;

    int completedRounds;
    int totalQuestions;
    int answeredQuestions;

    /**
     * Player id -> score.
     */
    @Builder.Default
    Map<String, PlayerScore> players = Map.of();

    /**
     * Team id -> score.
     */
    @Builder.Default
    Map<String, TeamScore> teams = Map.of();

    boolean active;
    boolean paused;
    boolean complete;

    /**
     * Epoch millis of the last local or remote modification.
     */
    long lastUpdated;

    @Builder.Default
    Map<String, Object> attributes = Map.of();
}
