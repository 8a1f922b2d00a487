package com.survivaladvisor.common.model;

import com.survivaladvisor.common.exception.UnknownVocabularyException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The six chief-equipment slots, declared in upgrade order (Infantry pair, Marksman pair,
 * Lancer pair).
 *
 * <p>Older profiles stored gear under generic piece names. Those names are accepted as
 * aliases: helmet=cap, armor=coat, gloves=pants, boots=watch, ring=belt, amulet=weapon.
 */
public enum GearSlot {

    COAT("coat", TroopClass.INFANTRY, "Infantry frontline - engage first, need survivability"),
    PANTS("pants", TroopClass.INFANTRY, "Infantry frontline - engage first, need survivability"),
    BELT("belt", TroopClass.MARKSMAN, "Marksman - key damage dealers"),
    WEAPON("weapon", TroopClass.MARKSMAN, "Marksman - key damage dealers"),
    CAP("cap", TroopClass.LANCER, "Lancer - mid-line support, lowest priority"),
    WATCH("watch", TroopClass.LANCER, "Lancer - mid-line support, lowest priority");

    private static final Map<String, GearSlot> LEGACY_ALIASES = Map.of(
        "helmet", CAP,
        "armor",  COAT,
        "gloves", PANTS,
        "boots",  WATCH,
        "ring",   BELT,
        "amulet", WEAPON
    );

    private final String key;
    private final TroopClass troopClass;
    private final String role;

    GearSlot(String key, TroopClass troopClass, String role) {
        this.key = key;
        this.troopClass = troopClass;
        this.role = role;
    }

    public String key() { return key; }

    public TroopClass troopClass() { return troopClass; }

    public String role() { return role; }

    /** 1-based upgrade rank: coat=1 ... watch=6. */
    public int upgradeRank() { return ordinal() + 1; }

    public String displayName() {
        return Character.toUpperCase(key.charAt(0)) + key.substring(1);
    }

    public static List<GearSlot> forTroopClass(TroopClass troopClass) {
        return Arrays.stream(values()).filter(s -> s.troopClass == troopClass).toList();
    }

    public static GearSlot fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (GearSlot slot : values()) {
                if (slot.key.equals(normalized)) {
                    return slot;
                }
            }
            GearSlot alias = LEGACY_ALIASES.get(normalized);
            if (alias != null) {
                return alias;
            }
        }
        throw new UnknownVocabularyException("gear slot", name,
            Arrays.stream(values()).map(GearSlot::key).toList());
    }
}
