package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How much the player cares about each activity, 1 (ignore) to 5 (critical).
 */
public record PlayPriorities(
    @JsonProperty("svs") int svs,
    @JsonProperty("rally") int rally,
    @JsonProperty("castle") int castle,
    @JsonProperty("exploration") int exploration
) {
    public static final PlayPriorities DEFAULT = new PlayPriorities(5, 4, 4, 3);

    public PlayPriorities {
        svs         = clamp(svs);
        rally       = clamp(rally);
        castle      = clamp(castle);
        exploration = clamp(exploration);
    }

    private static int clamp(int v) {
        return Math.max(1, Math.min(5, v));
    }
}
