package com.survivaladvisor.common.model;

import com.survivaladvisor.common.exception.UnknownVocabularyException;

import java.util.Arrays;
import java.util.Locale;

/**
 * The four per-hero gear slots.
 */
public enum HeroGearSlot {

    GOGGLES("goggles"),
    GLOVES("gloves"),
    BELT("belt"),
    BOOTS("boots");

    private final String key;

    HeroGearSlot(String key) {
        this.key = key;
    }

    public String key() { return key; }

    /** Accepts the slot name or its 1-based position ({@code "1"} .. {@code "4"}). */
    public static HeroGearSlot fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (HeroGearSlot slot : values()) {
                if (slot.key.equals(normalized) || String.valueOf(slot.ordinal() + 1).equals(normalized)) {
                    return slot;
                }
            }
        }
        throw new UnknownVocabularyException("hero gear slot", name,
            Arrays.stream(values()).map(HeroGearSlot::key).toList());
    }
}
