package com.survivaladvisor.common.reference;

import com.survivaladvisor.common.model.TroopClass;

import java.util.Optional;

/**
 * Static metadata for one hero. {@code heroClass} is null for heroes missing from the
 * reference table.
 */
public record HeroReference(
    String name,
    TroopClass heroClass,
    int generation,
    HeroTier tier,
    String rarity
) {
    public HeroReference {
        generation = Math.max(1, generation);
        tier       = tier != null ? tier : HeroTier.C;
        rarity     = rarity != null ? rarity : "Rare";
    }

    /** Defaults used for a hero the reference table does not know: tier C, generation 1. */
    public static HeroReference unknown(String name) {
        return new HeroReference(name, null, 1, HeroTier.C, "Rare");
    }

    public Optional<TroopClass> troopClass() {
        return Optional.ofNullable(heroClass);
    }
}
