package com.survivaladvisor.analysis.optimizer;

import java.util.Map;

/**
 * Collapses a multi-resource cost into one comparable number.
 *
 * <p>Each resource has a fixed weight; hero shard keys ({@code <hero>_shards}) share one
 * weight. Unknown resources weigh 1. The weights put the subsystems on a common scale, so
 * efficiencies are comparable across gear, charms, heroes, troops and research.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class CostNormalizer {

    private static final Map<String, Double> WEIGHTS = Map.of(
        "hardened_alloy",        1.25,
        "polishing_solution",    1.25,
        "charm_designs",         2.0,
        "charm_guides",          7.0 / 3.0,
        "hero_xp",               0.0001,
        "camp_upgrade",          10_000.0,
        "fire_crystal_shards",   1.0,
        "refined_fire_crystals", 10.0
    );

    private static final double HERO_SHARD_WEIGHT = 100.0;

    private CostNormalizer() {}

    public static double normalize(Map<String, Long> cost) {
        if (cost == null || cost.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (Map.Entry<String, Long> e : cost.entrySet()) {
            total += e.getValue() * weight(e.getKey());
        }
        return total;
    }

    /** Power per normalized cost unit; costs below one unit count as one. */
    public static double efficiency(double powerGain, Map<String, Long> cost) {
        return powerGain / Math.max(1.0, normalize(cost));
    }

    static double weight(String resource) {
        Double w = WEIGHTS.get(resource);
        if (w != null) {
            return w;
        }
        return resource.endsWith("_shards") ? HERO_SHARD_WEIGHT : 1.0;
    }
}
