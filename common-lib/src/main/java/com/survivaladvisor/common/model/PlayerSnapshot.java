package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical, immutable player state handed to every analyzer.
 *
 * <p>Built once per request, usually by
 * {@link com.survivaladvisor.common.snapshot.SnapshotNormalizer}. Every numeric field is a
 * non-negative integer and every unset field carries its tier-1/level-1 default, so
 * analyzers never test for absence.
 *
 * <p>{@code fireCrystalLevel} of 0 means the fire-crystal era has not been reached.
 * {@code heroes} is keyed by hero name and iterates in name order.
 */
public record PlayerSnapshot(
    @JsonProperty("furnaceLevel") int furnaceLevel,
    @JsonProperty("fireCrystalLevel") int fireCrystalLevel,
    @JsonProperty("stateAgeDays") int stateAgeDays,
    @JsonProperty("spenderTier") SpenderTier spenderTier,
    @JsonProperty("troopTier") int troopTier,
    @JsonProperty("warAcademyLevel") String warAcademyLevel,
    @JsonProperty("farmAccount") boolean farmAccount,
    @JsonProperty("priorities") PlayPriorities priorities,
    @JsonProperty("heroes") Map<String, HeroState> heroes,
    @JsonProperty("chiefEquipment") ChiefEquipment chiefEquipment
) {
    public static final String DEFAULT_WAR_ACADEMY_LEVEL = "FC1-0";

    public PlayerSnapshot {
        furnaceLevel     = Math.max(1, furnaceLevel);
        fireCrystalLevel = Math.max(0, fireCrystalLevel);
        stateAgeDays     = Math.max(0, stateAgeDays);
        spenderTier      = spenderTier != null ? spenderTier : SpenderTier.F2P;
        troopTier        = Math.max(1, Math.min(11, troopTier));
        warAcademyLevel  = warAcademyLevel == null || warAcademyLevel.isBlank()
                           ? DEFAULT_WAR_ACADEMY_LEVEL : warAcademyLevel.trim().toUpperCase();
        priorities       = priorities != null ? priorities : PlayPriorities.DEFAULT;
        heroes           = heroes != null
                           ? Collections.unmodifiableMap(new TreeMap<>(heroes))
                           : Collections.emptyMap();
        chiefEquipment   = chiefEquipment != null ? chiefEquipment : ChiefEquipment.baseline();
    }

    public boolean owns(String heroName) {
        return heroes.containsKey(heroName);
    }

    public boolean inFireCrystalEra() {
        return fireCrystalLevel > 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PlayerSnapshot empty() {
        return builder().build();
    }

    public static final class Builder {
        private int furnaceLevel = 1;
        private int fireCrystalLevel;
        private int stateAgeDays;
        private SpenderTier spenderTier = SpenderTier.F2P;
        private int troopTier = 1;
        private String warAcademyLevel = DEFAULT_WAR_ACADEMY_LEVEL;
        private boolean farmAccount;
        private PlayPriorities priorities = PlayPriorities.DEFAULT;
        private final Map<String, HeroState> heroes = new LinkedHashMap<>();
        private ChiefEquipment chiefEquipment = ChiefEquipment.baseline();

        private Builder() {}

        public Builder furnaceLevel(int v)            { this.furnaceLevel = v; return this; }
        public Builder fireCrystalLevel(int v)        { this.fireCrystalLevel = v; return this; }
        public Builder stateAgeDays(int v)            { this.stateAgeDays = v; return this; }
        public Builder spenderTier(SpenderTier v)     { this.spenderTier = v; return this; }
        public Builder troopTier(int v)               { this.troopTier = v; return this; }
        public Builder warAcademyLevel(String v)      { this.warAcademyLevel = v; return this; }
        public Builder farmAccount(boolean v)         { this.farmAccount = v; return this; }
        public Builder priorities(PlayPriorities v)   { this.priorities = v; return this; }
        public Builder hero(String name, HeroState s) { this.heroes.put(name, s); return this; }
        public Builder heroes(Map<String, HeroState> v) { this.heroes.putAll(v); return this; }
        public Builder chiefEquipment(ChiefEquipment v) { this.chiefEquipment = v; return this; }

        public PlayerSnapshot build() {
            return new PlayerSnapshot(furnaceLevel, fireCrystalLevel, stateAgeDays, spenderTier,
                troopTier, warAcademyLevel, farmAccount, priorities, heroes, chiefEquipment);
        }
    }
}
