package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Long-term level/star target for one owned hero, ranked by investment value.
 */
public record HeroInvestment(
    @JsonProperty("hero") String hero,
    @JsonProperty("heroClass") String heroClass,
    @JsonProperty("tier") String tier,
    @JsonProperty("generation") int generation,
    @JsonProperty("currentLevel") int currentLevel,
    @JsonProperty("targetLevel") int targetLevel,
    @JsonProperty("currentStars") int currentStars,
    @JsonProperty("targetStars") int targetStars,
    @JsonProperty("priority") int priority,
    @JsonProperty("reason") String reason
) {}
