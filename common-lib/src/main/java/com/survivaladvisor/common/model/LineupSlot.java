package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One filled (or unfilled) position of a lineup. {@code status} is human readable, for
 * example {@code Lv45}, {@code Not owned} or {@code Filler slot}.
 */
public record LineupSlot(
    @JsonProperty("position") String position,
    @JsonProperty("role") String role,
    @JsonProperty("hero") String hero,
    @JsonProperty("owned") boolean owned,
    @JsonProperty("status") String status
) {}
