package com.survivaladvisor.analysis.optimizer;

import com.survivaladvisor.common.model.CharmSlot;
import com.survivaladvisor.common.model.ChiefEquipment;
import com.survivaladvisor.common.model.GearPiece;
import com.survivaladvisor.common.model.GearSlot;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.PowerUpgrade;
import com.survivaladvisor.common.model.RecommendationCategory;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RecommendationSource;
import com.survivaladvisor.common.model.TroopClass;
import com.survivaladvisor.common.model.UpgradeConfidence;
import com.survivaladvisor.common.model.UpgradeType;
import com.survivaladvisor.common.reference.CharmLevelStep;
import com.survivaladvisor.common.reference.GearTierStep;
import com.survivaladvisor.common.reference.ReferenceData;
import com.survivaladvisor.common.reference.ResearchEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores single-step upgrades across every tracked subsystem by power gained per normalized
 * cost unit.
 *
 * <p>Gear, charm and hero figures are estimates derived from bonus tables or formulas.
 * Troop tiers and War Academy edges are read straight from reference tables. Research, pets
 * and Daybreak Island are not tracked and only get qualitative guidance. An upgrade whose
 * current level is already the maximum, or whose next step is missing from the reference
 * tables, is never emitted.
 */
@Component
public class PowerOptimizer {

    private static final Logger log = LoggerFactory.getLogger(PowerOptimizer.class);

    static final Comparator<PowerUpgrade> BY_EFFICIENCY =
        Comparator.comparingDouble(PowerUpgrade::efficiency).reversed()
            .thenComparingInt(PowerUpgrade::priority);

    /** First chief-gear tier of each quality (index = quality value). */
    private static final int[] QUALITY_BASE_TIER = {0, 1, 1, 3, 7, 15, 27, 35};

    private static final double POWER_PER_GEAR_BONUS  = 750;
    private static final double POWER_PER_CHARM_BONUS = 500;
    private static final int HERO_LEVEL_STEP = 5;
    private static final long TROOP_SAMPLE = 50_000;

    private static final Pattern FC_PREFIX = Pattern.compile("^FC(\\d+)");

    private final ReferenceData referenceData;

    public PowerOptimizer(ReferenceData referenceData) {
        this.referenceData = referenceData;
    }

    /** Every candidate upgrade, qualitative ones included, best efficiency first. */
    public List<PowerUpgrade> analyze(PlayerSnapshot snapshot) {
        List<PowerUpgrade> upgrades = new ArrayList<>();
        upgrades.addAll(analyzeChiefGear(snapshot.chiefEquipment()));
        upgrades.addAll(analyzeChiefCharms(snapshot.chiefEquipment()));
        upgrades.addAll(analyzeHeroes(snapshot));
        upgrades.addAll(analyzeTroops(snapshot.troopTier()));
        analyzeWarAcademy(snapshot.warAcademyLevel()).ifPresent(upgrades::add);
        upgrades.addAll(qualitative());

        upgrades.sort(BY_EFFICIENCY);
        log.info("[PowerOptimizer] Scored upgrades={}", upgrades.size());
        return upgrades;
    }

    /** Tracked upgrades only (exact or estimated), best efficiency first. */
    public List<PowerUpgrade> getTopRecommendations(PlayerSnapshot snapshot, int limit) {
        return analyze(snapshot).stream()
            .filter(PowerUpgrade::isTracked)
            .limit(Math.max(0, limit))
            .collect(Collectors.toList());
    }

    public List<PowerUpgrade> getRecommendationsByType(PlayerSnapshot snapshot, UpgradeType type) {
        return analyze(snapshot).stream()
            .filter(u -> u.upgradeType() == type)
            .collect(Collectors.toList());
    }

    // ── chief gear ─────────────────────────────────────────────────────────

    static int gearTier(GearPiece piece) {
        return Math.min(42, QUALITY_BASE_TIER[piece.quality()] + piece.level() - 1);
    }

    private List<PowerUpgrade> analyzeChiefGear(ChiefEquipment equipment) {
        Map<GearSlot, Integer> tiers = new EnumMap<>(GearSlot.class);
        for (GearSlot slot : GearSlot.values()) {
            tiers.put(slot, gearTier(equipment.piece(slot)));
        }
        double avgTier = tiers.values().stream().mapToInt(Integer::intValue).average().orElse(1);

        List<PowerUpgrade> upgrades = new ArrayList<>();
        for (GearSlot slot : GearSlot.values()) {
            int tier = tiers.get(slot);
            if (tier >= referenceData.maxGearTier()) {
                continue;
            }
            Optional<GearTierStep> next = referenceData.gearTier(tier + 1);
            if (next.isEmpty()) {
                continue;
            }
            double currentBonus = referenceData.gearTier(tier).map(GearTierStep::bonusPercent).orElse(0.0);
            double nextBonus = next.get().bonusPercent();
            double bonusGain = Math.max(0, nextBonus - currentBonus);
            double power = bonusGain * POWER_PER_GEAR_BONUS;

            int basePriority = gearPriority(slot.troopClass());
            int priority = tier < avgTier - 3 ? Math.max(1, basePriority - 1) : basePriority;

            Map<String, Long> cost = new LinkedHashMap<>();
            cost.put("hardened_alloy", tier * 50L);
            cost.put("polishing_solution", tier * 30L);

            String from = referenceData.gearTier(tier).map(GearTierStep::name).orElse("Tier " + tier);
            upgrades.add(upgrade(UpgradeType.CHIEF_GEAR,
                slot.displayName() + " (" + slot.troopClass().displayName() + ")",
                from, next.get().name(), power, bonusGain, cost, priority,
                String.format("+%.1f%% bonus (%.1f%% → %.1f%%)", bonusGain, currentBonus, nextBonus),
                UpgradeConfidence.ESTIMATED, "gear", "all"));
        }
        return upgrades;
    }

    private static int gearPriority(TroopClass troopClass) {
        return switch (troopClass) {
            case INFANTRY -> 1;
            case MARKSMAN -> 2;
            case LANCER   -> 3;
        };
    }

    // ── chief charms ───────────────────────────────────────────────────────

    private List<PowerUpgrade> analyzeChiefCharms(ChiefEquipment equipment) {
        List<PowerUpgrade> upgrades = new ArrayList<>();
        for (CharmSlot slot : CharmSlot.ALL) {
            int level = equipment.charmLevel(slot);
            if (level >= referenceData.maxCharmLevel()) {
                continue;
            }
            Optional<CharmLevelStep> next = referenceData.charmLevel(level + 1);
            if (next.isEmpty()) {
                continue;
            }
            Optional<CharmLevelStep> current = referenceData.charmLevel(level);
            double currentBonus = current.map(CharmLevelStep::bonusPercent).orElse(0.0);
            double bonusGain = Math.max(0, next.get().bonusPercent() - currentBonus);

            String currentShape = current.map(CharmLevelStep::shape).orElse("");
            String nextShape = next.get().shape();
            String shapeChange = currentShape.equals(nextShape) ? "" : " (" + currentShape + " → " + nextShape + ")";

            Map<String, Long> cost = new LinkedHashMap<>();
            cost.put("charm_designs", level * 20L);
            cost.put("charm_guides", level * 15L);

            upgrades.add(upgrade(UpgradeType.CHIEF_CHARM, slot.displayName(),
                "Lv" + level, "Lv" + (level + 1), bonusGain * POWER_PER_CHARM_BONUS, bonusGain, cost,
                slot.type().priority(),
                String.format("+%.0f%% bonus (%.0f%% → %.0f%%)%s", bonusGain, currentBonus,
                    next.get().bonusPercent(), shapeChange),
                UpgradeConfidence.ESTIMATED, "charms", "all"));
        }
        return upgrades;
    }

    // ── heroes ─────────────────────────────────────────────────────────────

    private List<PowerUpgrade> analyzeHeroes(PlayerSnapshot snapshot) {
        List<PowerUpgrade> upgrades = new ArrayList<>();
        snapshot.heroes().forEach((name, state) -> {
            heroLevel(name, state).ifPresent(upgrades::add);
            heroStar(name, state).ifPresent(upgrades::add);
        });
        return upgrades;
    }

    private Optional<PowerUpgrade> heroLevel(String name, HeroState state) {
        int level = state.level();
        if (level >= HeroState.MAX_LEVEL) {
            return Optional.empty();
        }
        int nextLevel = Math.min(level + HERO_LEVEL_STEP, HeroState.MAX_LEVEL);
        long powerPerLevel = 500 + level * 20L;
        long power = powerPerLevel * (nextLevel - level);

        long xp = 0;
        for (int l = level; l < nextLevel; l++) {
            xp += referenceData.heroXpForLevel(l).orElse(0);
        }

        return Optional.of(upgrade(UpgradeType.HERO_LEVEL, name, "Lv" + level, "Lv" + nextLevel,
            power, 0, Map.of("hero_xp", xp), level < 40 ? 2 : 3,
            String.format("~%,d power/level. Higher levels increase troop capacity.", powerPerLevel),
            UpgradeConfidence.ESTIMATED, "heroes", "all"));
    }

    private Optional<PowerUpgrade> heroStar(String name, HeroState state) {
        int stars = state.stars();
        if (stars >= HeroState.MAX_STARS) {
            return Optional.empty();
        }
        int nextStar = stars + 1;
        long shards = referenceData.shardsForStar(nextStar).orElse(0);
        long power = 15_000 + stars * 5_000L;

        String unlocks = "";
        if (nextStar == 1) {
            unlocks = " Unlocks Exclusive Gear slot!";
        } else if (nextStar == 4) {
            unlocks = " Can max all skills!";
        }

        return Optional.of(upgrade(UpgradeType.HERO_STAR, name, stars + "★", nextStar + "★",
            power, 0, Map.of(name + "_shards", shards), stars < 3 ? 2 : 3,
            "~10-15% stat boost. Needs " + shards + " shards." + unlocks,
            UpgradeConfidence.ESTIMATED, "heroes", "all"));
    }

    // ── troops and research ────────────────────────────────────────────────

    private List<PowerUpgrade> analyzeTroops(int currentTier) {
        int nextTier = currentTier + 1;
        List<PowerUpgrade> upgrades = new ArrayList<>();
        for (TroopClass troop : List.of(TroopClass.INFANTRY, TroopClass.LANCER, TroopClass.MARKSMAN)) {
            OptionalLong current = referenceData.troopPower(currentTier, troop);
            OptionalLong next = referenceData.troopPower(nextTier, troop);
            if (current.isEmpty() || next.isEmpty()) {
                continue;
            }
            long perUnit = Math.max(0, next.getAsLong() - current.getAsLong());
            long total = perUnit * TROOP_SAMPLE;

            int priority;
            String reason;
            if (nextTier == 11 && troop != TroopClass.INFANTRY) {
                priority = 1;
                reason = "MASSIVE jump: " + current.getAsLong() + " → " + next.getAsLong()
                    + " power/unit! T11 requires War Academy.";
            } else {
                priority = 3;
                reason = String.format("+%d power/unit (%d → %d). Per 50k troops: +%,d power.",
                    perUnit, current.getAsLong(), next.getAsLong(), total);
            }
            upgrades.add(upgrade(UpgradeType.TROOP_TIER, troop.displayName(), "T" + currentTier, "T" + nextTier,
                total, 0, Map.of("camp_upgrade", 1L), priority, reason, UpgradeConfidence.EXACT, "troops", "all"));
        }
        return upgrades;
    }

    private Optional<PowerUpgrade> analyzeWarAcademy(String currentLevel) {
        Optional<ResearchEdge> found = referenceData.warAcademyEdge(currentLevel);
        if (found.isEmpty()) {
            log.debug("[PowerOptimizer] No war academy edge from level={}", currentLevel);
            return Optional.empty();
        }
        ResearchEdge edge = found.get();

        Matcher m = FC_PREFIX.matcher(edge.fromLevel());
        int fc = m.find() ? Integer.parseInt(m.group(1)) : 1;

        List<String> summary = new ArrayList<>();
        long shards = edge.cost().getOrDefault("fire_crystal_shards", 0L);
        long refined = edge.cost().getOrDefault("refined_fire_crystals", 0L);
        if (shards > 0)  summary.add(shards + " FC shards");
        if (refined > 0) summary.add(refined + " refined FC");

        return Optional.of(upgrade(UpgradeType.WAR_ACADEMY, "War Academy", edge.fromLevel(), edge.toLevel(),
            edge.powerGain(), 0, edge.cost(), fc < 5 ? 2 : 3,
            String.format("EXACT: +%,d power. Requires %s. Cost: %s", edge.powerGain(), edge.prerequisite(),
                String.join(", ", summary)),
            UpgradeConfidence.EXACT, "war_academy", "troops", "all"));
    }

    private static List<PowerUpgrade> qualitative() {
        return List.of(
            upgrade(UpgradeType.RESEARCH, "Research Trees", "Current", "Next", 0, 0, Map.of(), 4,
                "Focus: Battle tree for combat, Growth tree for resources, Economy for production. Not tracked.",
                UpgradeConfidence.QUALITATIVE, "research", "all"),
            upgrade(UpgradeType.PET, "Pets", "Current", "Next", 0, 0, Map.of(), 4,
                "Priority: Panda (All troops buff), Fox (Marksman), Bear (Infantry), Lion (Lancer). Not tracked.",
                UpgradeConfidence.QUALITATIVE, "pets", "all"),
            upgrade(UpgradeType.DAYBREAK, "Daybreak Island - Tree of Life", "Current", "Next", 0, 0, Map.of(), 5,
                "Tree of Life provides troop stat buffs. Unlocks at higher FC levels. Not tracked.",
                UpgradeConfidence.QUALITATIVE, "daybreak", "all"));
    }

    private static PowerUpgrade upgrade(UpgradeType type, String target, String from, String to,
                                        double power, double bonus, Map<String, Long> cost, int priority,
                                        String reason, UpgradeConfidence confidence, String... tags) {
        double efficiency = confidence == UpgradeConfidence.QUALITATIVE ? 0.0 : CostNormalizer.efficiency(power, cost);
        return new PowerUpgrade(type, target, from, to, power, bonus, cost, efficiency, priority, reason,
            confidence, new LinkedHashSet<>(List.of(tags)));
    }

    // ── conversion ─────────────────────────────────────────────────────────

    /** Converts a scored upgrade into the common record shape under the POWER category. */
    public static RecommendationRecord toRecommendation(PowerUpgrade u) {
        List<String> details = new ArrayList<>();
        if (u.powerGain() > 0)  details.add(String.format("+%,.0f power", u.powerGain()));
        if (u.bonusGain() > 0)  details.add(String.format("+%.1f%%", u.bonusGain()));
        if (u.efficiency() > 0) details.add(String.format("Efficiency: %.1f", u.efficiency()));
        String detail = details.isEmpty() ? "" : " (" + String.join(", ", details) + ")";

        String cost = u.resourceCost().entrySet().stream()
            .map(e -> e.getKey() + ": " + e.getValue())
            .collect(Collectors.joining(", "));

        return new RecommendationRecord(u.priority(),
            "Upgrade " + u.target() + ": " + u.fromLevel() + " → " + u.toLevel(),
            RecommendationCategory.POWER, u.target(), u.reason() + detail, cost, u.relevanceTags(),
            RecommendationSource.POWER, "power_" + u.upgradeType().key());
    }
}
