package com.survivaladvisor.common.model;

import com.survivaladvisor.common.exception.UnknownVocabularyException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Troop classes in gear-upgrade order: front line first, ranged second, support last.
 */
public enum TroopClass {

    INFANTRY("Infantry"),
    MARKSMAN("Marksman"),
    LANCER("Lancer");

    private final String displayName;

    TroopClass(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }

    public static TroopClass fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (TroopClass c : values()) {
                if (c.name().equals(normalized)) {
                    return c;
                }
            }
        }
        throw new UnknownVocabularyException("troop class", name,
            Arrays.stream(values()).map(TroopClass::displayName).toList());
    }
}
