package com.qqsuccubus.triviasync.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Cumulative and per-round score of one team, with its member user ids.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class TeamScore {
    String teamId;
    String name;
    int totalPoints;
    @Builder.Default
    Map<Integer, Integer> roundPoints = Map.of();
    @Builder.Default
    List<String> members = List.of();
}
