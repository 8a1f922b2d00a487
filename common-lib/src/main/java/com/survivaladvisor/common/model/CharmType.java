package com.survivaladvisor.common.model;

import com.survivaladvisor.common.exception.UnknownVocabularyException;

import java.util.Arrays;
import java.util.Locale;

/**
 * The three charm sockets carried by every chief-equipment piece.
 */
public enum CharmType {

    PROTECTION("protection", TroopClass.INFANTRY, 1),
    VISION("vision", TroopClass.MARKSMAN, 2),
    KEENNESS("keenness", TroopClass.LANCER, 3);

    private final String key;
    private final TroopClass troopClass;
    private final int priority;

    CharmType(String key, TroopClass troopClass, int priority) {
        this.key = key;
        this.troopClass = troopClass;
        this.priority = priority;
    }

    public String key() { return key; }

    public TroopClass troopClass() { return troopClass; }

    public int priority() { return priority; }

    public String displayName() {
        return Character.toUpperCase(key.charAt(0)) + key.substring(1);
    }

    public static CharmType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (CharmType t : values()) {
                if (t.key.equals(normalized)) {
                    return t;
                }
            }
        }
        throw new UnknownVocabularyException("charm type", name,
            Arrays.stream(values()).map(CharmType::key).toList());
    }
}
