package com.survivaladvisor.common.model;

import com.survivaladvisor.common.exception.UnknownVocabularyException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Subsystems the power optimizer scores. The last three are untracked and only ever
 * produce qualitative guidance.
 */
public enum UpgradeType {

    CHIEF_GEAR("chief_gear", true),
    CHIEF_CHARM("chief_charm", true),
    HERO_LEVEL("hero_level", true),
    HERO_STAR("hero_star", true),
    TROOP_TIER("troop_tier", true),
    WAR_ACADEMY("war_academy", true),
    RESEARCH("research", false),
    PET("pet", false),
    DAYBREAK("daybreak", false);

    private final String key;
    private final boolean tracked;

    UpgradeType(String key, boolean tracked) {
        this.key = key;
        this.tracked = tracked;
    }

    public String key() { return key; }

    public boolean tracked() { return tracked; }

    public static UpgradeType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (UpgradeType t : values()) {
                if (t.key.equals(normalized)) {
                    return t;
                }
            }
        }
        throw new UnknownVocabularyException("upgrade type", name,
            Arrays.stream(values()).map(UpgradeType::key).toList());
    }
}
