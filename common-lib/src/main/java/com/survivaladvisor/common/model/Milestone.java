package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Next progression goal. {@code type} is {@code furnace}, {@code fc} or {@code endgame};
 * {@code distance} counts levels still to go.
 */
public record Milestone(
    @JsonProperty("type") String type,
    @JsonProperty("target") String target,
    @JsonProperty("name") String name,
    @JsonProperty("benefit") String benefit,
    @JsonProperty("distance") int distance
) {}
