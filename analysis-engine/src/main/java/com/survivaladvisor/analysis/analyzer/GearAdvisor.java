package com.survivaladvisor.analysis.analyzer;

import com.survivaladvisor.common.model.CharmSlot;
import com.survivaladvisor.common.model.ChiefEquipment;
import com.survivaladvisor.common.model.GearPriorityEntry;
import com.survivaladvisor.common.model.GearQuality;
import com.survivaladvisor.common.model.GearSlot;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationCategory;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;
import com.survivaladvisor.common.model.SpenderTier;
import com.survivaladvisor.common.model.TroopClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chief gear, charm and hero gear advice.
 *
 * <p>Chief gear is upgraded as a set: all six pieces at the same quality keep the set
 * bonuses, and when pushing the next quality the order is Infantry (coat, pants), then
 * Marksman (belt, weapon), then Lancer (cap, watch). Hero gear is capped per spender tier
 * and never goes on pure rally joiners unless the player is a whale. New hero gear is only
 * suggested once every chief piece is Legendary.
 */
@Component
@Order(2)
public class GearAdvisor implements RuleAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GearAdvisor.class);

    private static final String GEAR_MATERIALS = "Hardened Alloy, Polishing Solution, Design Plans";

    private static final int LEGENDARY = GearQuality.LEGENDARY.value();
    private static final int MYTHIC    = GearQuality.MYTHIC.value();

    private static final Set<String> JOINER_HEROES = Set.of(HeroAnalyzer.ATTACK_JOINER, HeroAnalyzer.DEFENSE_JOINER);

    private static final Map<SpenderTier, List<String>> HERO_GEAR_TARGETS = new EnumMap<>(Map.of(
        SpenderTier.F2P,     List.of("Molly", "Alonso"),
        SpenderTier.MINNOW,  List.of("Alonso", "Jeronimo", "Molly"),
        SpenderTier.DOLPHIN, List.of("Jeronimo", "Alonso", "Molly"),
        SpenderTier.ORCA,    List.of("Jeronimo", "Alonso", "Molly"),
        SpenderTier.WHALE,   List.of("All core heroes")
    ));

    @Override
    public List<RecommendationRecord> analyze(PlayerSnapshot snapshot) {
        ChiefEquipment equipment = snapshot.chiefEquipment();
        SpenderTier spender = snapshot.spenderTier();
        boolean tracked = equipment.gear().values().stream().anyMatch(p -> p.isInvested());

        log.info("[GearAdvisor] Analyzing spender={} gearTracked={}", spender.key(), tracked);

        List<RecommendationRecord> records = new ArrayList<>();
        records.addAll(analyzeChiefGear(equipment, tracked));
        if (tracked) {
            records.addAll(analyzeStatBalance(equipment));
        }
        records.addAll(analyzeCharmBalance(equipment));
        records.addAll(analyzeHeroGear(snapshot, spender));
        records.addAll(checkCommonMistakes(snapshot, equipment));

        records.sort(Comparator.comparingInt(RecommendationRecord::priority));
        log.debug("[GearAdvisor] Produced records={}", records.size());
        return records;
    }

    @Override
    public String analyzerName() {
        return "GearAdvisor";
    }

    @Override
    public RuleHandler handler() {
        return RuleHandler.GEAR_ADVISOR;
    }

    // ── chief gear ─────────────────────────────────────────────────────────

    private List<RecommendationRecord> analyzeChiefGear(ChiefEquipment equipment, boolean tracked) {
        List<RecommendationRecord> records = new ArrayList<>();

        if (!tracked) {
            records.add(RecommendationRecord.rule(1, RecommendationCategory.GEAR,
                "Keep all 6 Chief Gear pieces at SAME TIER for set bonuses", "all",
                "6-piece set bonus gives Attack to ALL troops. Don't max one piece while others lag.",
                GEAR_MATERIALS, "set_bonus_first", "all", "svs", "rally"));
            records.add(RecommendationRecord.rule(2, RecommendationCategory.GEAR,
                "Upgrade Infantry gear (Coat/Pants) first when pushing to next tier", "coat/pants",
                "Infantry engage first in battle - frontline survivability is critical.",
                GEAR_MATERIALS, "infantry_first", "svs", "rally", "pvp"));
            return records;
        }

        for (GearSlot slot : GearSlot.values()) {
            int quality = equipment.quality(slot);
            if (quality >= LEGENDARY) {
                continue;
            }
            int priority = slot.upgradeRank();
            if (quality < GearQuality.RARE.value()) {
                priority = Math.max(1, priority - 1);
            }
            records.add(RecommendationRecord.rule(Math.min(priority, RecommendationRecord.LOWEST_PRIORITY),
                RecommendationCategory.GEAR,
                "Upgrade " + slot.key() + " to Legendary (currently " + GearQuality.of(quality).displayName() + ")",
                slot.key(), slot.role(), GEAR_MATERIALS, "upgrade_" + slot.key(), "all"));
        }

        int min = minQuality(equipment);
        int max = maxQuality(equipment);

        if (max - min >= 2) {
            String lagging = laggingPieces(equipment, max);
            records.add(0, RecommendationRecord.rule(1, RecommendationCategory.GEAR,
                "Bring lagging pieces (" + lagging + ") up to same tier", "multiple",
                "Keep all 6 pieces at SAME TIER for set bonuses. 6-piece Attack bonus helps ALL troops.",
                GEAR_MATERIALS, "set_bonus_warning", "critical", "efficiency"));
        }

        if (min >= LEGENDARY) {
            for (GearSlot slot : GearSlot.values()) {
                if (equipment.quality(slot) < MYTHIC) {
                    TroopClass troop = slot.troopClass();
                    records.add(RecommendationRecord.rule(troop == TroopClass.INFANTRY ? 2 : 3,
                        RecommendationCategory.GEAR,
                        "Push " + slot.key() + " to Mythic", slot.key(),
                        "All Legendary done. " + troop.displayName() + " (" + slot.key() + ") - " + slot.role(),
                        "Lunar Amber, Mythic materials", "mythic_" + slot.key(), "endgame"));
                    break;
                }
            }
        }
        return records;
    }

    private static String laggingPieces(ChiefEquipment equipment, int max) {
        return Arrays.stream(GearSlot.values())
            .filter(s -> equipment.quality(s) < max)
            .map(GearSlot::key)
            .collect(Collectors.joining(", "));
    }

    // ── stat and charm balance ─────────────────────────────────────────────

    /** Flags the weakest troop-class gear pair once it trails the strongest by a full quality. */
    private List<RecommendationRecord> analyzeStatBalance(ChiefEquipment equipment) {
        Map<TroopClass, Double> averages = new EnumMap<>(TroopClass.class);
        for (TroopClass troop : TroopClass.values()) {
            averages.put(troop, GearSlot.forTroopClass(troop).stream()
                .mapToInt(equipment::quality).average().orElse(1));
        }
        TroopClass weakest = weakest(averages);
        TroopClass strongest = strongest(averages);
        if (averages.get(strongest) - averages.get(weakest) < 1.0) {
            return List.of();
        }

        String weakLabel = pairLabel(weakest);
        String strongLabel = pairLabel(strongest);
        String weakName = GearQuality.of(averages.get(weakest).intValue()).displayName();
        String strongName = GearQuality.of(averages.get(strongest).intValue()).displayName();

        return List.of(RecommendationRecord.rule(2, RecommendationCategory.GEAR,
            "Upgrade " + weakest.displayName() + " gear (" + weakLabel + ") - lagging behind", weakLabel,
            "Your " + weakest.displayName() + " stats are lagging (" + weakName + " vs " + strongName + " "
                + strongest.displayName() + "). " + weakLabel + " upgrades will have higher marginal impact than pushing "
                + strongLabel + " further.",
            GEAR_MATERIALS, "stat_balance_gear", "stat_balance", "efficiency"));
    }

    /** Charm levels are grouped by the troop class of the equipment piece carrying them. */
    private List<RecommendationRecord> analyzeCharmBalance(ChiefEquipment equipment) {
        Map<TroopClass, Double> averages = new EnumMap<>(TroopClass.class);
        for (TroopClass troop : TroopClass.values()) {
            averages.put(troop, CharmSlot.ALL.stream()
                .filter(slot -> slot.piece().troopClass() == troop)
                .mapToInt(equipment::charmLevel).average().orElse(1));
        }
        TroopClass weakest = weakest(averages);
        TroopClass strongest = strongest(averages);
        double min = averages.get(weakest);
        double max = averages.get(strongest);
        if (max - min < 2.0) {
            return List.of();
        }

        String weak = weakest.displayName();
        String strong = strongest.displayName();
        return List.of(RecommendationRecord.rule(2, RecommendationCategory.GEAR,
            "Upgrade " + weak + " charms - lagging behind other types", weak + " charms",
            String.format("Your %s charms (avg L%.0f) are behind %s charms (avg L%.0f). Upgrade %s charms before "
                + "pushing %s charms further, balanced charms also unlock the army-wide bonus.",
                weak, min, strong, max, weak, strong),
            "Charm materials", "stat_balance_charms", "stat_balance", "charms"));
    }

    private static TroopClass weakest(Map<TroopClass, Double> averages) {
        TroopClass result = TroopClass.INFANTRY;
        for (TroopClass t : TroopClass.values()) {
            if (averages.get(t) < averages.get(result)) result = t;
        }
        return result;
    }

    private static TroopClass strongest(Map<TroopClass, Double> averages) {
        TroopClass result = TroopClass.INFANTRY;
        for (TroopClass t : TroopClass.values()) {
            if (averages.get(t) > averages.get(result)) result = t;
        }
        return result;
    }

    private static String pairLabel(TroopClass troop) {
        return GearSlot.forTroopClass(troop).stream().map(GearSlot::displayName).collect(Collectors.joining("/"));
    }

    // ── hero gear ──────────────────────────────────────────────────────────

    private List<RecommendationRecord> analyzeHeroGear(PlayerSnapshot snapshot, SpenderTier spender) {
        List<RecommendationRecord> records = new ArrayList<>();
        List<String> geared = gearedHeroes(snapshot);
        int cap = spender.heroGearCap();
        boolean chiefSetDone = minQuality(snapshot.chiefEquipment()) >= LEGENDARY;

        if (geared.size() > cap) {
            records.add(RecommendationRecord.rule(1, RecommendationCategory.GEAR,
                "Stop spreading hero gear investment", "general",
                spender.name() + " should only gear " + cap + (cap == 1 ? " hero" : " heroes")
                    + " (you have " + geared.size() + "). Chief Gear Ring/Amulet should be priority.",
                "N/A - this is a warning", spender.key() + "_hero_gear_limit", spender.key(), "efficiency"));
        } else if (spender == SpenderTier.F2P && geared.isEmpty() && chiefSetDone) {
            records.add(RecommendationRecord.rule(3, RecommendationCategory.GEAR,
                "Consider hero gear for Molly OR Alonso (not both)", "Molly or Alonso",
                "F2P can invest in one field DPS hero. Only after Ring/Amulet are at Legendary.",
                "Hero Gear XP, Essence Stones", "f2p_first_hero_gear", "f2p", "field_pvp"));
        }

        if (spender != SpenderTier.WHALE) {
            for (String joiner : geared) {
                if (JOINER_HEROES.contains(joiner)) {
                    records.add(RecommendationRecord.rule(1, RecommendationCategory.GEAR,
                        "Don't invest more hero gear in " + joiner, joiner,
                        joiner + " is a joiner hero. Only their expedition skill matters in rallies - hero gear is wasted.",
                        "N/A - redirect to Chief Gear", "no_joiner_gear", "warning", "efficiency"));
                }
            }
        }

        boolean capped = spender == SpenderTier.MINNOW || spender == SpenderTier.DOLPHIN || spender == SpenderTier.ORCA;
        if (capped && chiefSetDone) {
            for (String target : HERO_GEAR_TARGETS.get(spender)) {
                HeroState state = snapshot.heroes().get(target);
                if (state != null && !state.hasGearInvestment() && geared.size() < cap) {
                    records.add(RecommendationRecord.rule(3, RecommendationCategory.GEAR,
                        "Start hero gear on " + target, target,
                        target + " is a good hero gear target for " + spender.key()
                            + " players. Used across multiple modes.",
                        "Hero Gear XP, Essence Stones, Mithril", "hero_gear_" + target.toLowerCase(), "hero_gear"));
                }
            }
        }
        return records;
    }

    private static List<String> gearedHeroes(PlayerSnapshot snapshot) {
        return snapshot.heroes().entrySet().stream()
            .filter(e -> e.getValue().hasGearInvestment())
            .map(Map.Entry::getKey)
            .toList();
    }

    // ── common mistakes ────────────────────────────────────────────────────

    private List<RecommendationRecord> checkCommonMistakes(PlayerSnapshot snapshot, ChiefEquipment equipment) {
        List<RecommendationRecord> records = new ArrayList<>();
        int min = minQuality(equipment);
        int max = maxQuality(equipment);

        if (!gearedHeroes(snapshot).isEmpty() && min < LEGENDARY) {
            records.add(RecommendationRecord.rule(1, RecommendationCategory.GEAR,
                "Prioritize Chief Gear over Hero Gear", "all",
                "Chief Gear multiplies ALL damage. Hero Gear only affects one hero. Get 6-piece Legendary set first.",
                "Hardened Alloy, Polishing Solution", "chief_before_hero", "warning", "efficiency"));
        }

        if (max - min >= 2) {
            records.add(RecommendationRecord.rule(1, RecommendationCategory.GEAR,
                "Stop upgrading one piece while others lag behind", "multiple",
                "You're losing set bonuses! 6-piece Attack bonus requires all pieces at same tier. "
                    + "Bring lagging pieces up first.",
                "N/A - redirect to lagging pieces", "set_bonus_mistake", "warning", "critical"));
        }

        int infantryMin = Math.min(equipment.quality(GearSlot.COAT), equipment.quality(GearSlot.PANTS));
        int lancerMax = Math.max(equipment.quality(GearSlot.CAP), equipment.quality(GearSlot.WATCH));
        if (lancerMax > infantryMin && min >= GearQuality.EPIC.value()) {
            records.add(RecommendationRecord.rule(2, RecommendationCategory.GEAR,
                "Prioritize Infantry gear (Coat/Pants) over Lancer (Cap/Watch)", "coat/pants",
                "Infantry engage first in battle - frontline survivability is critical. Upgrade Infantry before Lancer.",
                "N/A - redirect to Infantry gear", "infantry_before_lancer", "warning"));
        }
        return records;
    }

    private static int minQuality(ChiefEquipment equipment) {
        return equipment.gear().values().stream().mapToInt(p -> p.quality()).min().orElse(1);
    }

    private static int maxQuality(ChiefEquipment equipment) {
        return equipment.gear().values().stream().mapToInt(p -> p.quality()).max().orElse(1);
    }

    // ── static priority order ──────────────────────────────────────────────

    /** Recommended upgrade order: the set rule, chief gear by troop class, then hero gear targets. */
    public List<GearPriorityEntry> gearPriorityOrder(SpenderTier spender) {
        List<GearPriorityEntry> order = new ArrayList<>();
        order.add(new GearPriorityEntry("chief", "ALL 6 pieces",
            "Keep all at SAME TIER for 6-piece Attack set bonus (benefits ALL troops)", "Critical"));

        for (GearSlot slot : GearSlot.values()) {
            String label = switch (slot.troopClass()) {
                case INFANTRY -> "High (Infantry first when pushing next tier)";
                case MARKSMAN -> "Medium (Marksman second)";
                case LANCER   -> "Lower (Lancer last)";
            };
            order.add(new GearPriorityEntry("chief", slot.key(), slot.role(), label));
        }

        List<String> targets = HERO_GEAR_TARGETS.get(spender);
        int count = Math.min(targets.size(), spender.heroGearCap());
        for (int i = 0; i < count; i++) {
            order.add(new GearPriorityEntry("hero", targets.get(i),
                "Hero gear target #" + (i + 1) + " for " + spender.key(), "After Chief Gear"));
        }
        return order;
    }
}
