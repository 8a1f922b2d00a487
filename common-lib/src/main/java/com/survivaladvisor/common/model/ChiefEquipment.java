package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chief-level equipment state: six gear pieces and eighteen charm sockets.
 *
 * <p>The compact constructor fills every missing slot with the baseline piece and every
 * missing charm socket with level 1, so consumers always see a complete picture.
 */
public record ChiefEquipment(
    @JsonProperty("gear") Map<GearSlot, GearPiece> gear,
    @JsonProperty("charms") Map<CharmSlot, Integer> charms
) {
    public ChiefEquipment {
        Map<GearSlot, GearPiece> fullGear = new EnumMap<>(GearSlot.class);
        for (GearSlot slot : GearSlot.values()) {
            GearPiece piece = gear != null ? gear.get(slot) : null;
            fullGear.put(slot, piece != null ? piece : GearPiece.BASELINE);
        }
        Map<CharmSlot, Integer> fullCharms = new LinkedHashMap<>();
        for (CharmSlot slot : CharmSlot.ALL) {
            Integer level = charms != null ? charms.get(slot) : null;
            fullCharms.put(slot, level != null ? Math.max(1, level) : 1);
        }
        gear   = Collections.unmodifiableMap(fullGear);
        charms = Collections.unmodifiableMap(fullCharms);
    }

    public static ChiefEquipment baseline() {
        return new ChiefEquipment(Map.of(), Map.of());
    }

    /** Convenience for the common case of gear qualities only, charms at baseline. */
    public static ChiefEquipment ofQualities(Map<GearSlot, Integer> qualities) {
        Map<GearSlot, GearPiece> gear = new EnumMap<>(GearSlot.class);
        qualities.forEach((slot, quality) -> gear.put(slot, GearPiece.of(quality, 1)));
        return new ChiefEquipment(gear, Map.of());
    }

    public GearPiece piece(GearSlot slot) {
        return gear.get(slot);
    }

    public int quality(GearSlot slot) {
        return gear.get(slot).quality();
    }

    public int charmLevel(CharmSlot slot) {
        return charms.get(slot);
    }
}
