package com.survivaladvisor.common.reference;

import java.util.Map;

/**
 * One War Academy research step. Power gain and cost are exact game figures.
 */
public record ResearchEdge(
    String fromLevel,
    String toLevel,
    long powerGain,
    Map<String, Long> cost,
    String prerequisite
) {
    public ResearchEdge {
        cost         = cost != null ? Map.copyOf(cost) : Map.of();
        prerequisite = prerequisite != null ? prerequisite : "";
    }
}
