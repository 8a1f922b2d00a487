package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Common output shape of every analyzer and of the power optimizer once converted.
 *
 * <p>Immutable. The orchestrator reorders and filters records but never rewrites them.
 * {@code ruleId} names the rule that fired and is stable across releases.
 */
public record RecommendationRecord(
    @JsonProperty("priority") int priority,
    @JsonProperty("action") String action,
    @JsonProperty("category") RecommendationCategory category,
    @JsonProperty("target") String target,
    @JsonProperty("reason") String reason,
    @JsonProperty("resourceCost") String resourceCost,
    @JsonProperty("relevanceTags") Set<String> relevanceTags,
    @JsonProperty("source") RecommendationSource source,
    @JsonProperty("ruleId") String ruleId
) {
    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY  = 5;

    public RecommendationRecord {
        if (priority < HIGHEST_PRIORITY || priority > LOWEST_PRIORITY) {
            throw new IllegalArgumentException("priority must be 1..5, was " + priority);
        }
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(source, "source");
        reason        = reason != null ? reason : "";
        resourceCost  = resourceCost != null ? resourceCost : "";
        relevanceTags = relevanceTags != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(relevanceTags))
                        : Collections.emptySet();
        ruleId        = ruleId != null ? ruleId : "";
    }

    /** Factory for rule-sourced records; {@code target} may be null. */
    public static RecommendationRecord rule(int priority, RecommendationCategory category, String action,
                                            String target, String reason, String resourceCost,
                                            Collection<String> tags, String ruleId) {
        return new RecommendationRecord(priority, action, category, target, reason, resourceCost,
            tags == null ? null : new LinkedHashSet<>(tags), RecommendationSource.RULES, ruleId);
    }

    public static RecommendationRecord rule(int priority, RecommendationCategory category, String action,
                                            String target, String reason, String resourceCost,
                                            String ruleId, String... tags) {
        return rule(priority, category, action, target, reason, resourceCost, List.of(tags), ruleId);
    }

    /** Case-insensitive, whitespace-collapsed action text used for deduplication. */
    public String normalizedAction() {
        return action.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
