package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PhaseInfo(
    @JsonProperty("phase") GamePhase phase,
    @JsonProperty("name") String name,
    @JsonProperty("focus") List<String> focus,
    @JsonProperty("commonMistakes") List<String> commonMistakes,
    @JsonProperty("bottlenecks") List<String> bottlenecks,
    @JsonProperty("nextMilestone") Milestone nextMilestone,
    @JsonProperty("resourcePriorities") List<String> resourcePriorities
) {}
