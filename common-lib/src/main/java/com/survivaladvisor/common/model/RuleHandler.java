package com.survivaladvisor.common.model;

import com.survivaladvisor.common.exception.UnknownVocabularyException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Analyzer a deterministic question is routed to. {@link #COMBINED} means the merged
 * output of every analyzer plus the power optimizer.
 */
public enum RuleHandler {

    HERO_ANALYZER("hero_analyzer"),
    GEAR_ADVISOR("gear_advisor"),
    LINEUP_BUILDER("lineup_builder"),
    PROGRESSION_TRACKER("progression_tracker"),
    COMBINED("combined");

    private final String key;

    RuleHandler(String key) {
        this.key = key;
    }

    public String key() { return key; }

    public static RuleHandler fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (RuleHandler h : values()) {
                if (h.key.equals(normalized)) {
                    return h;
                }
            }
        }
        throw new UnknownVocabularyException("rule handler", name,
            Arrays.stream(values()).map(RuleHandler::key).toList());
    }
}
