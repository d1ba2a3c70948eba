package com.qqsuccubus.triviasync.realtime.state;

import com.qqsuccubus.triviasync.core.model.GameState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies the difference between a local and a remote version.
 * <p>
 * Precedence: equal hashes mean no conflict, then differing version numbers
 * ({@link ConflictType#VERSION}), then timestamps closer than the concurrency window
 * ({@link ConflictType#CONCURRENT}), otherwise {@link ConflictType#TIMESTAMP}.
 * </p>
 */
public final class ConflictDetector {
    private ConflictDetector() {
    }

    public static Optional<StateConflict> detect(StateVersion local, StateVersion remote, long concurrentWindowMs) {
        if (Objects.equals(local.getHash(), remote.getHash())) {
            return Optional.empty();
        }

        ConflictType type;
        if (local.getVersion() != remote.getVersion()) {
            type = ConflictType.VERSION;
        } else if (Math.abs(local.getTimestamp() - remote.getTimestamp()) < concurrentWindowMs) {
            type = ConflictType.CONCURRENT;
        } else {
            type = ConflictType.TIMESTAMP;
        }
        return Optional.of(new StateConflict(local, remote, type, conflictingFields(local.getState(), remote.getState())));
    }

    public static List<String> conflictingFields(GameState local, GameState remote) {
        List<String> fields = new ArrayList<>();
        if (local == null || remote == null) {
            return fields;
        }
        check(fields, "phase", local.getPhase(), remote.getPhase());
        check(fields, "currentRound", local.getCurrentRound(), remote.getCurrentRound());
        check(fields, "currentQuestion", local.getCurrentQuestion(), remote.getCurrentQuestion());
        check(fields, "active", local.isActive(), remote.isActive());
        check(fields, "paused", local.isPaused(), remote.isPaused());
        check(fields, "completedRounds", local.getCompletedRounds(), remote.getCompletedRounds());
        check(fields, "answeredQuestions", local.getAnsweredQuestions(), remote.getAnsweredQuestions());
        check(fields, "players", local.getPlayers(), remote.getPlayers());
        check(fields, "teams", local.getTeams(), remote.getTeams());
        return fields;
    }

    private static void check(List<String> fields, String name, Object local, Object remote) {
        if (!Objects.equals(local, remote)) {
            fields.add(name);
        }
    }
}
