package com.qqsuccubus.triviasync.realtime.state;

import com.qqsuccubus.triviasync.core.model.GamePhase;
import com.qqsuccubus.triviasync.core.model.GameState;
import com.qqsuccubus.triviasync.core.model.PlayerScore;
import com.qqsuccubus.triviasync.core.model.TeamScore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field-wise merge of two game states.
 * <ul>
 *   <li>phase: further along the game flow wins, {@code paused} loses to any ranked phase</li>
 *   <li>currentRound, completedRounds, answeredQuestions: max</li>
 *   <li>active: OR, paused: AND</li>
 *   <li>players and teams: key by key, max total, union of round points (max per round);
 *       teams also union their members</li>
 *   <li>attributes: delegated to an {@link AttributeMerger}</li>
 *   <li>everything else: from the version with the later timestamp (remote on ties)</li>
 * </ul>
 */
public final class GameStateMerger {
    private GameStateMerger() {
    }

    @FunctionalInterface
    public interface AttributeMerger {
        Map<String, Object> merge(Map<String, Object> local, long localTimestamp,
                                  Map<String, Object> remote, long remoteTimestamp);
    }

    /**
     * Attribute merge that keeps the later side wholesale.
     */
    public static final AttributeMerger LATER_WINS =
        (local, localTs, remote, remoteTs) -> localTs > remoteTs ? local : remote;

    public static GameState merge(StateVersion local, StateVersion remote, AttributeMerger attributeMerger) {
        GameState l = local.getState();
        GameState r = remote.getState();
        GameState later = local.getTimestamp() > remote.getTimestamp() ? l : r;

        return later.toBuilder()
            .phase(mergePhase(l.getPhase(), r.getPhase(), later.getPhase()))
            .currentRound(Math.max(l.getCurrentRound(), r.getCurrentRound()))
            .completedRounds(Math.max(l.getCompletedRounds(), r.getCompletedRounds()))
            .answeredQuestions(Math.max(l.getAnsweredQuestions(), r.getAnsweredQuestions()))
            .active(l.isActive() || r.isActive())
            .paused(l.isPaused() && r.isPaused())
            .players(mergePlayers(l.getPlayers(), r.getPlayers()))
            .teams(mergeTeams(l.getTeams(), r.getTeams()))
            .lastUpdated(Math.max(l.getLastUpdated(), r.getLastUpdated()))
            .attributes(attributeMerger.merge(l.getAttributes(), local.getTimestamp(),
                r.getAttributes(), remote.getTimestamp()))
            .build();
    }

    static GamePhase mergePhase(GamePhase local, GamePhase remote, GamePhase fallback) {
        if (local != null && local.isAfter(remote)) {
            return local;
        }
        if (remote != null && remote.isAfter(local)) {
            return remote;
        }
        return fallback;
    }

    static Map<String, PlayerScore> mergePlayers(Map<String, PlayerScore> local, Map<String, PlayerScore> remote) {
        Map<String, PlayerScore> merged = new LinkedHashMap<>(remote);
        local.forEach((id, mine) -> merged.merge(id, mine, (theirs, ours) -> {
            PlayerScore newer = ours.getLastActive() > theirs.getLastActive() ? ours : theirs;
            return newer.toBuilder()
                .totalPoints(Math.max(ours.getTotalPoints(), theirs.getTotalPoints()))
                .roundPoints(mergeRoundPoints(ours.getRoundPoints(), theirs.getRoundPoints()))
                .lastActive(Math.max(ours.getLastActive(), theirs.getLastActive()))
                .build();
        }));
        return merged;
    }

    static Map<String, TeamScore> mergeTeams(Map<String, TeamScore> local, Map<String, TeamScore> remote) {
        Map<String, TeamScore> merged = new LinkedHashMap<>(remote);
        local.forEach((id, mine) -> merged.merge(id, mine, (theirs, ours) -> theirs.toBuilder()
            .totalPoints(Math.max(ours.getTotalPoints(), theirs.getTotalPoints()))
            .roundPoints(mergeRoundPoints(ours.getRoundPoints(), theirs.getRoundPoints()))
            .members(unionMembers(theirs.getMembers(), ours.getMembers()))
            .build()));
        return merged;
    }

    private static Map<Integer, Integer> mergeRoundPoints(Map<Integer, Integer> a, Map<Integer, Integer> b) {
        Map<Integer, Integer> merged = new HashMap<>(a);
        b.forEach((round, points) -> merged.merge(round, points, Math::max));
        return merged;
    }

    static List<String> unionMembers(List<String> a, List<String> b) {
        Set<String> members = new LinkedHashSet<>(a);
        members.addAll(b);
        return new ArrayList<>(members);
    }
}
