package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One step of the static gear upgrade order for a spender tier. {@code gearType} is
 * {@code chief} or {@code hero}; {@code priority} is a human-readable label.
 */
public record GearPriorityEntry(
    @JsonProperty("gearType") String gearType,
    @JsonProperty("piece") String piece,
    @JsonProperty("reason") String reason,
    @JsonProperty("priority") String priority
) {}
