package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Owned-hero progress. Skill lists always hold exactly three levels, the first expedition
 * skill being the one that applies when the hero joins a rally.
 */
public record HeroState(
    @JsonProperty("level") int level,
    @JsonProperty("stars") int stars,
    @JsonProperty("expeditionSkills") List<Integer> expeditionSkills,
    @JsonProperty("explorationSkills") List<Integer> explorationSkills,
    @JsonProperty("gear") Map<HeroGearSlot, GearPiece> gear
) {
    public static final int MAX_LEVEL = 80;
    public static final int MAX_STARS = 5;
    public static final int MAX_SKILL = 5;

    public HeroState {
        level = Math.max(1, level);
        stars = Math.max(0, Math.min(MAX_STARS, stars));
        expeditionSkills  = normalizeSkills(expeditionSkills);
        explorationSkills = normalizeSkills(explorationSkills);
        Map<HeroGearSlot, GearPiece> fullGear = new EnumMap<>(HeroGearSlot.class);
        for (HeroGearSlot slot : HeroGearSlot.values()) {
            GearPiece piece = gear != null ? gear.get(slot) : null;
            fullGear.put(slot, piece != null ? piece : GearPiece.BASELINE);
        }
        gear = Collections.unmodifiableMap(fullGear);
    }

    public static HeroState of(int level, int stars) {
        return new HeroState(level, stars, List.of(), List.of(), Map.of());
    }

    public static HeroState of(int level, int stars, int expeditionSkill, int explorationSkill) {
        return new HeroState(level, stars,
            List.of(expeditionSkill, 1, 1), List.of(explorationSkill, 1, 1), Map.of());
    }

    /** Level of the rally-joiner skill (top-right expedition skill). */
    public int joinerSkillLevel() {
        return expeditionSkills.get(0);
    }

    public int bestExpeditionSkill() {
        return Collections.max(expeditionSkills);
    }

    public int bestExplorationSkill() {
        return Collections.max(explorationSkills);
    }

    public int totalSkillLevels() {
        int total = 0;
        for (int s : expeditionSkills)  total += s;
        for (int s : explorationSkills) total += s;
        return total;
    }

    public boolean hasGearInvestment() {
        return gear.values().stream().anyMatch(GearPiece::isInvested);
    }

    private static List<Integer> normalizeSkills(List<Integer> raw) {
        Integer[] levels = {1, 1, 1};
        if (raw != null) {
            for (int i = 0; i < Math.min(3, raw.size()); i++) {
                Integer v = raw.get(i);
                levels[i] = v == null ? 1 : Math.max(1, Math.min(MAX_SKILL, v));
            }
        }
        return List.of(levels);
    }
}
