package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record LineupResult(
    @JsonProperty("gameMode") String gameMode,
    @JsonProperty("modeName") String modeName,
    @JsonProperty("heroes") List<LineupSlot> heroes,
    @JsonProperty("troopRatio") Map<TroopClass, Integer> troopRatio,
    @JsonProperty("notes") String notes,
    @JsonProperty("confidence") LineupConfidence confidence,
    @JsonProperty("recommendedToGet") List<String> recommendedToGet
) {
    public LineupResult {
        heroes           = List.copyOf(heroes);
        troopRatio       = Map.copyOf(troopRatio);
        recommendedToGet = List.copyOf(recommendedToGet);
    }
}
