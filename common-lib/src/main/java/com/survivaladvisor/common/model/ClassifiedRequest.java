package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Routing metadata for one question. {@code ruleHandler} is null for AI-routed questions.
 */
public record ClassifiedRequest(
    @JsonProperty("intentType") IntentType intentType,
    @JsonProperty("category") String category,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("ruleHandler") RuleHandler ruleHandler,
    @JsonProperty("reason") String reason
) {
    public static ClassifiedRequest ai(String category, double confidence, String reason) {
        return new ClassifiedRequest(IntentType.AI, category, confidence, null, reason);
    }

    public static ClassifiedRequest rules(IntentType intentType, String category, double confidence,
                                          RuleHandler handler, String reason) {
        return new ClassifiedRequest(intentType, category, confidence, handler, reason);
    }

    public boolean routesToRules() {
        return intentType == IntentType.RULES || intentType == IntentType.HYBRID;
    }
}
