package com.survivaladvisor.common.model;

/**
 * Equipment quality ladder. Numeric values match the stored profile encoding (1..7).
 */
public enum GearQuality {

    COMMON(1, "Common"),
    UNCOMMON(2, "Uncommon"),
    RARE(3, "Rare"),
    EPIC(4, "Epic"),
    GOLD(5, "Gold"),
    LEGENDARY(6, "Legendary"),
    MYTHIC(7, "Mythic");

    private final int value;
    private final String displayName;

    GearQuality(int value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public int value() { return value; }

    public String displayName() { return displayName; }

    /** Clamps out-of-range values into 1..7. */
    public static GearQuality of(int value) {
        int clamped = Math.max(1, Math.min(7, value));
        return values()[clamped - 1];
    }
}
