package com.survivaladvisor.common.reference;

import com.survivaladvisor.common.model.TroopClass;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Immutable game reference tables, loaded once per process by {@link ReferenceDataLoader}.
 *
 * <p>Every lookup tolerates gaps: a missing table yields empty results, an unknown hero
 * yields {@link HeroReference#unknown(String)}.
 */
public final class ReferenceData {

    private static final ReferenceData EMPTY = new ReferenceData(
        Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

    private final Map<String, HeroReference> heroes;
    private final Map<Integer, GearTierStep> gearTiers;
    private final Map<Integer, CharmLevelStep> charmLevels;
    private final Map<Integer, Map<TroopClass, Long>> troopPower;
    private final Map<String, ResearchEdge> warAcademyEdges;
    private final Map<Integer, Long> heroXpPerLevel;
    private final Map<Integer, Long> shardsPerStar;

    public ReferenceData(Map<String, HeroReference> heroes,
                         Map<Integer, GearTierStep> gearTiers,
                         Map<Integer, CharmLevelStep> charmLevels,
                         Map<Integer, Map<TroopClass, Long>> troopPower,
                         Map<String, ResearchEdge> warAcademyEdges,
                         Map<Integer, Long> heroXpPerLevel,
                         Map<Integer, Long> shardsPerStar) {
        Map<String, HeroReference> byKey = new LinkedHashMap<>();
        heroes.forEach((name, ref) -> byKey.put(key(name), ref));
        Map<Integer, Map<TroopClass, Long>> troops = new TreeMap<>();
        troopPower.forEach((tier, perClass) -> {
            Map<TroopClass, Long> copy = new EnumMap<>(TroopClass.class);
            copy.putAll(perClass);
            troops.put(tier, Collections.unmodifiableMap(copy));
        });
        this.heroes          = Collections.unmodifiableMap(byKey);
        this.gearTiers       = Collections.unmodifiableMap(new TreeMap<>(gearTiers));
        this.charmLevels     = Collections.unmodifiableMap(new TreeMap<>(charmLevels));
        this.troopPower      = Collections.unmodifiableMap(troops);
        this.warAcademyEdges = Collections.unmodifiableMap(new LinkedHashMap<>(warAcademyEdges));
        this.heroXpPerLevel  = Collections.unmodifiableMap(new TreeMap<>(heroXpPerLevel));
        this.shardsPerStar   = Collections.unmodifiableMap(new TreeMap<>(shardsPerStar));
    }

    public static ReferenceData empty() {
        return EMPTY;
    }

    // ── heroes ─────────────────────────────────────────────────────────────

    public HeroReference hero(String name) {
        HeroReference ref = name == null ? null : heroes.get(key(name));
        return ref != null ? ref : HeroReference.unknown(name);
    }

    public boolean knowsHero(String name) {
        return name != null && heroes.containsKey(key(name));
    }

    /** Catalogue spelling of a hero name, matched case-insensitively. */
    public Optional<String> canonicalHeroName(String name) {
        HeroReference ref = name == null ? null : heroes.get(key(name));
        return ref == null ? Optional.empty() : Optional.ofNullable(ref.name());
    }

    public Map<String, HeroReference> heroes() {
        return heroes;
    }

    // ── chief equipment ────────────────────────────────────────────────────

    public Optional<GearTierStep> gearTier(int tier) {
        return Optional.ofNullable(gearTiers.get(tier));
    }

    public int maxGearTier() {
        return gearTiers.isEmpty() ? 0 : Collections.max(gearTiers.keySet());
    }

    public Optional<CharmLevelStep> charmLevel(int level) {
        return Optional.ofNullable(charmLevels.get(level));
    }

    public int maxCharmLevel() {
        return charmLevels.isEmpty() ? 0 : Collections.max(charmLevels.keySet());
    }

    // ── troops and research ────────────────────────────────────────────────

    public OptionalLong troopPower(int tier, TroopClass troopClass) {
        Map<TroopClass, Long> perClass = troopPower.get(tier);
        if (perClass == null || !perClass.containsKey(troopClass)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(perClass.get(troopClass));
    }

    public Optional<ResearchEdge> warAcademyEdge(String fromLevel) {
        if (fromLevel == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(warAcademyEdges.get(fromLevel.trim().toUpperCase(Locale.ROOT)));
    }

    // ── hero power ─────────────────────────────────────────────────────────

    /** XP needed to go from {@code level} to {@code level + 1}; empty when not tabulated. */
    public OptionalLong heroXpForLevel(int level) {
        Long xp = heroXpPerLevel.get(level);
        return xp == null ? OptionalLong.empty() : OptionalLong.of(xp);
    }

    /** Shards needed to reach {@code star}; empty when not tabulated. */
    public OptionalLong shardsForStar(int star) {
        Long shards = shardsPerStar.get(star);
        return shards == null ? OptionalLong.empty() : OptionalLong.of(shards);
    }

    public boolean isEmpty() {
        return heroes.isEmpty() && gearTiers.isEmpty() && charmLevels.isEmpty() && troopPower.isEmpty()
            && warAcademyEdges.isEmpty() && heroXpPerLevel.isEmpty() && shardsPerStar.isEmpty();
    }

    private static String key(String heroName) {
        return heroName.trim().toLowerCase(Locale.ROOT);
    }
}
