package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rally-joining advice. {@code hero} is null when no suitable joiner is owned.
 */
public record JoinerAdvice(
    @JsonProperty("hero") String hero,
    @JsonProperty("owned") boolean owned,
    @JsonProperty("skillLevel") int skillLevel,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("action") String action,
    @JsonProperty("criticalNote") String criticalNote
) {}
