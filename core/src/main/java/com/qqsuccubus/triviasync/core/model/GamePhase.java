package com.qqsuccubus.triviasync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phases of a trivia game in progression order.
 * <p>
 * {@link #PAUSED} is orthogonal to progression and has no rank.
 * </p>
 */
public enum GamePhase {
    PRE_GAME("pre-game", 0),
    ROUND_INTRO("round-intro", 1),
    QUESTION_SELECTION("question-selection", 2),
    QUESTION_DISPLAY("question-display", 3),
    ANSWER_SUBMISSION("answer-submission", 4),
    ANSWER_REVIEW("answer-review", 5),
    SCORING("scoring", 6),
    ROUND_COMPLETE("round-complete", 7),
    GAME_COMPLETE("game-complete", 8),
    PAUSED("paused", -1);

    private final String wireName;
    private final int progression;

    GamePhase(String wireName, int progression) {
        this.wireName = wireName;
        this.progression = progression;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @return position in the game flow, -1 for {@link #PAUSED}
     */
    public int progression() {
        return progression;
    }

    /**
     * @return true if this phase comes strictly after {@code other} in the game flow
     */
    public boolean isAfter(GamePhase other) {
        return other == null || progression > other.progression;
    }

    @JsonCreator
    public static GamePhase fromWireName(String value) {
        for (GamePhase phase : values()) {
            if (phase.wireName.equals(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown game phase: " + value);
    }
}
