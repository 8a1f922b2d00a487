package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One scored upgrade edge between two adjacent tiers/levels of a subsystem.
 *
 * <p>{@code efficiency} is power gain per normalized cost unit and is computed by the
 * optimizer, never supplied by callers. Resource quantities are validated non-negative.
 */
public record PowerUpgrade(
    @JsonProperty("upgradeType") UpgradeType upgradeType,
    @JsonProperty("target") String target,
    @JsonProperty("fromLevel") String fromLevel,
    @JsonProperty("toLevel") String toLevel,
    @JsonProperty("powerGain") double powerGain,
    @JsonProperty("bonusGain") double bonusGain,
    @JsonProperty("resourceCost") Map<String, Long> resourceCost,
    @JsonProperty("efficiency") double efficiency,
    @JsonProperty("priority") int priority,
    @JsonProperty("reason") String reason,
    @JsonProperty("confidence") UpgradeConfidence confidence,
    @JsonProperty("relevanceTags") Set<String> relevanceTags
) {
    public PowerUpgrade {
        Objects.requireNonNull(upgradeType, "upgradeType");
        Objects.requireNonNull(confidence, "confidence");
        if (priority < 1 || priority > 5) {
            throw new IllegalArgumentException("priority must be 1..5, was " + priority);
        }
        if (powerGain < 0) {
            throw new IllegalArgumentException("powerGain must be non-negative, was " + powerGain);
        }
        Map<String, Long> cost = new LinkedHashMap<>();
        if (resourceCost != null) {
            resourceCost.forEach((resource, qty) -> {
                if (qty == null || qty < 0) {
                    throw new IllegalArgumentException(
                        "resource cost for " + resource + " must be non-negative, was " + qty);
                }
                cost.put(resource, qty);
            });
        }
        resourceCost  = Collections.unmodifiableMap(cost);
        relevanceTags = relevanceTags != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(relevanceTags))
                        : Collections.emptySet();
        reason        = reason != null ? reason : "";
    }

    public long totalCost() {
        return resourceCost.values().stream().mapToLong(Long::longValue).sum();
    }

    public boolean isTracked() {
        return confidence != UpgradeConfidence.QUALITATIVE;
    }
}
