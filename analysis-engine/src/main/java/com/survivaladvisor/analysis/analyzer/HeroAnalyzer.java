package com.survivaladvisor.analysis.analyzer;

import com.survivaladvisor.analysis.scoring.GenerationTimeline;
import com.survivaladvisor.analysis.scoring.HeroValueScorer;
import com.survivaladvisor.common.model.HeroInvestment;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.PlayPriorities;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationCategory;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;
import com.survivaladvisor.common.model.SpenderTier;
import com.survivaladvisor.common.reference.HeroReference;
import com.survivaladvisor.common.reference.HeroTier;
import com.survivaladvisor.common.reference.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Hero roster rules: main-three levelling, rally joiners, generation coverage, skill gaps
 * and star ascension.
 *
 * <p>Rules run in that order and the combined list is stably sorted by priority, so
 * records of equal priority keep rule order.
 */
@Component
@Order(1)
public class HeroAnalyzer implements RuleAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(HeroAnalyzer.class);

    /** Rule id of the single record emitted for an empty roster. */
    public static final String NO_HEROES_RULE_ID = "no_heroes";

    public static final String ATTACK_JOINER  = "Jessie";
    public static final String DEFENSE_JOINER = "Sergey";

    static final int MAIN_HERO_LEVEL = 40;
    static final int SKILL_GAP_MIN_LEVEL = 30;
    private static final int FARM_INVESTMENT_CAP = 2;

    private static final int[] STAND_OF_ARMS    = {5, 10, 15, 20, 25};
    private static final int[] DEFENDERS_EDGE   = {4, 8, 12, 16, 20};

    private static final double SKILL_GAP_THRESHOLD = 0.4;
    private static final double STAR_THRESHOLD      = 0.5;

    private final HeroValueScorer scorer;
    private final ReferenceData referenceData;

    public HeroAnalyzer(HeroValueScorer scorer) {
        this.scorer = scorer;
        this.referenceData = scorer.referenceData();
    }

    @Override
    public List<RecommendationRecord> analyze(PlayerSnapshot snapshot) {
        int currentGen = GenerationTimeline.currentGeneration(snapshot.stateAgeDays());
        PlayPriorities p = snapshot.priorities();

        log.info("[HeroAnalyzer] Analyzing heroes={} generation={}", snapshot.heroes().size(), currentGen);

        List<RecommendationRecord> records = new ArrayList<>();
        records.addAll(checkMainThree(snapshot, currentGen));
        records.addAll(checkJoinerHeroes(snapshot, p.rally(), p.castle()));
        records.addAll(checkGenerationHeroes(snapshot, currentGen));
        records.addAll(checkSkillGaps(snapshot, p.rally(), p.exploration(), currentGen));
        records.addAll(checkStarProgression(snapshot, currentGen));

        records.sort(Comparator.comparingInt(RecommendationRecord::priority));
        log.debug("[HeroAnalyzer] Produced records={}", records.size());
        return records;
    }

    @Override
    public String analyzerName() {
        return "HeroAnalyzer";
    }

    @Override
    public RuleHandler handler() {
        return RuleHandler.HERO_ANALYZER;
    }

    // ── main three ─────────────────────────────────────────────────────────

    private List<RecommendationRecord> checkMainThree(PlayerSnapshot snapshot, int currentGen) {
        Map<String, HeroState> heroes = snapshot.heroes();
        if (heroes.isEmpty()) {
            return List.of(RecommendationRecord.rule(1, RecommendationCategory.HERO,
                "Add heroes to your profile", "Any",
                "No heroes tracked. Add your heroes to get personalized recommendations.",
                "N/A", NO_HEROES_RULE_ID, "all"));
        }

        long leveled = heroes.values().stream().filter(h -> h.level() >= MAIN_HERO_LEVEL).count();
        if (leveled >= 3) {
            return List.of();
        }

        List<RecommendationRecord> records = new ArrayList<>();
        List<String> underleveled = scorer.rankOwned(snapshot).stream()
            .filter(name -> heroes.get(name).level() < MAIN_HERO_LEVEL)
            .limit(3 - leveled)
            .toList();

        for (String name : underleveled) {
            HeroTier tier = referenceData.hero(name).tier();
            if (!tier.isAtLeast(HeroTier.A)) {
                continue;
            }
            records.add(RecommendationRecord.rule(1, RecommendationCategory.HERO,
                "Level " + name + " to 40+", name,
                tier.label() + " tier hero, only Lv" + heroes.get(name).level()
                    + ". Focus main 3 heroes before spreading investment.",
                "Hero XP items, Meat for barracks", "level_main_three", "all"));
        }
        return records;
    }

    // ── rally joiners ──────────────────────────────────────────────────────

    private List<RecommendationRecord> checkJoinerHeroes(PlayerSnapshot snapshot, int rallyPriority, int castlePriority) {
        List<RecommendationRecord> records = new ArrayList<>();

        if (rallyPriority >= 3) {
            int priority = rallyPriority >= 4 ? 1 : 2;
            HeroState jessie = snapshot.heroes().get(ATTACK_JOINER);
            if (jessie == null) {
                records.add(RecommendationRecord.rule(priority, RecommendationCategory.HERO,
                    "Unlock Jessie", ATTACK_JOINER,
                    "Best attack joiner. Her Stand of Arms (+5-25% DMG) is the top skill when joining rallies.",
                    "Jessie shards from events/shop", "unlock_jessie", "rally", "svs"));
            } else if (jessie.joinerSkillLevel() < HeroState.MAX_SKILL) {
                int skill = jessie.joinerSkillLevel();
                records.add(RecommendationRecord.rule(priority, RecommendationCategory.HERO,
                    "Max Jessie's expedition skill (currently Lv" + skill + ")", ATTACK_JOINER,
                    "Stand of Arms at +" + STAND_OF_ARMS[skill - 1]
                        + "% → +25% at L5. Put her slot 1 when joining rallies!",
                    "Expedition Manuals", "level_jessie_skill", "rally", "svs"));
            }
        }

        if (castlePriority >= 3) {
            HeroState sergey = snapshot.heroes().get(DEFENSE_JOINER);
            if (sergey == null) {
                records.add(RecommendationRecord.rule(2, RecommendationCategory.HERO,
                    "Unlock Sergey", DEFENSE_JOINER,
                    "Best defense joiner. His Defenders' Edge (-4-20% DMG taken) protects garrison.",
                    "Sergey shards from events/shop", "unlock_sergey", "castle", "garrison"));
            } else if (sergey.joinerSkillLevel() < HeroState.MAX_SKILL) {
                int skill = sergey.joinerSkillLevel();
                records.add(RecommendationRecord.rule(2, RecommendationCategory.HERO,
                    "Level Sergey's expedition skill (currently Lv" + skill + ")", DEFENSE_JOINER,
                    "Defenders' Edge at -" + DEFENDERS_EDGE[skill - 1]
                        + "% → -20% at L5. Put him slot 1 when reinforcing!",
                    "Expedition Manuals", "level_sergey_skill", "castle", "garrison"));
            }
        }
        return records;
    }

    // ── generation coverage ────────────────────────────────────────────────

    private List<RecommendationRecord> checkGenerationHeroes(PlayerSnapshot snapshot, int currentGen) {
        if (currentGen < 2) {
            return List.of();
        }
        List<RecommendationRecord> records = new ArrayList<>();
        for (int gen = Math.max(2, currentGen - 1); gen <= currentGen; gen++) {
            List<String> genHeroes = heroesOfGeneration(gen);
            if (genHeroes.size() < 2) {
                continue;
            }
            boolean ownsAny = genHeroes.stream().anyMatch(snapshot::owns);
            if (ownsAny) {
                continue;
            }
            int priority = gen == currentGen ? 2 : 3;
            records.add(RecommendationRecord.rule(priority, RecommendationCategory.HERO,
                "Acquire Gen " + gen + " heroes", genHeroes.get(0) + ", " + genHeroes.get(1),
                "Gen " + gen + " heroes are significant upgrades. " + genHeroes.get(0) + " or "
                    + genHeroes.get(1) + " recommended.",
                "Hero shards from events, packs, or VIP shop", "acquire_gen" + gen,
                "svs", "rally", "progression"));
        }
        return records;
    }

    /** Reference-table heroes of one generation, in table order. */
    List<String> heroesOfGeneration(int generation) {
        return referenceData.heroes().values().stream()
            .filter(h -> h.generation() == generation)
            .map(HeroReference::name)
            .toList();
    }

    // ── skills and stars ───────────────────────────────────────────────────

    private List<RecommendationRecord> checkSkillGaps(PlayerSnapshot snapshot, int rallyPriority,
                                                      int explorationPriority, int currentGen) {
        List<RecommendationRecord> records = new ArrayList<>();
        snapshot.heroes().forEach((name, state) -> {
            if (scorer.tierRelevance(name, currentGen) < SKILL_GAP_THRESHOLD
                    || state.level() < SKILL_GAP_MIN_LEVEL) {
                return;
            }
            String tier = referenceData.hero(name).tier().label();

            int expedition = state.bestExpeditionSkill();
            if (rallyPriority >= 3 && expedition < HeroState.MAX_SKILL) {
                records.add(RecommendationRecord.rule(2, RecommendationCategory.HERO,
                    "Upgrade " + name + "'s expedition skill to L" + (expedition + 1), name,
                    tier + " tier hero. Expedition skills boost rally/SvS performance.",
                    "Expedition Manuals", "upgrade_expedition_skill", "rally", "svs"));
            }

            int exploration = state.bestExplorationSkill();
            if (explorationPriority >= 3 && exploration < HeroState.MAX_SKILL) {
                records.add(RecommendationRecord.rule(3, RecommendationCategory.HERO,
                    "Upgrade " + name + "'s exploration skill to L" + (exploration + 1), name,
                    tier + " tier hero. Exploration skills help clear PvE content.",
                    "Exploration Manuals", "upgrade_exploration_skill", "pve", "exploration"));
            }
        });
        return records;
    }

    private List<RecommendationRecord> checkStarProgression(PlayerSnapshot snapshot, int currentGen) {
        List<RecommendationRecord> records = new ArrayList<>();
        snapshot.heroes().forEach((name, state) -> {
            if (scorer.tierRelevance(name, currentGen) < STAR_THRESHOLD) {
                return;
            }
            if (state.stars() < HeroState.MAX_STARS && state.level() >= MAIN_HERO_LEVEL) {
                String tier = referenceData.hero(name).tier().label();
                records.add(RecommendationRecord.rule(3, RecommendationCategory.HERO,
                    "Ascend " + name + " to " + (state.stars() + 1) + " stars", name,
                    tier + " tier hero at " + state.stars() + "★. Star upgrades provide significant stat boosts.",
                    name + " shards or universal shards", "ascend_stars", "all"));
            }
        });
        return records;
    }

    // ── investment plan ────────────────────────────────────────────────────

    /**
     * Level/star targets for the most valuable owned heroes. The number of heroes planned is
     * the spender tier's investment cap, or two for farm accounts; {@code limit} truncates
     * the result further.
     */
    public List<HeroInvestment> investmentPlan(PlayerSnapshot snapshot, int limit) {
        if (snapshot.heroes().isEmpty() || limit <= 0) {
            return List.of();
        }
        int currentGen = GenerationTimeline.currentGeneration(snapshot.stateAgeDays());
        SpenderTier spender = snapshot.spenderTier();
        int cap = snapshot.farmAccount() ? FARM_INVESTMENT_CAP : spender.heroInvestmentCap();

        List<String> ranked = scorer.rankOwned(snapshot);
        List<HeroInvestment> plan = new ArrayList<>();
        int rank = 1;
        for (String name : ranked.subList(0, Math.min(cap, ranked.size()))) {
            plan.add(investmentFor(name, snapshot, currentGen, rank++));
        }
        log.debug("[HeroAnalyzer] Investment plan spender={} planned={}", spender.key(), plan.size());
        return plan.stream().limit(limit).collect(Collectors.toList());
    }

    private HeroInvestment investmentFor(String name, PlayerSnapshot snapshot, int currentGen, int rank) {
        HeroReference ref = referenceData.hero(name);
        HeroState state = snapshot.heroes().get(name);
        int gen = ref.generation();
        String tier = ref.tier().label();

        int[] target = targetFor(snapshot.spenderTier(), gen, currentGen);
        int targetLevel = target[0];
        int targetStars = target[1];

        String reason;
        if (snapshot.farmAccount()) {
            reason = "Farm account: minimal investment. Focus on joining rallies.";
        } else if (gen < currentGen - 2) {
            reason = "Outdated (Gen " + gen + "). Save resources for newer heroes.";
            targetLevel = Math.min(targetLevel, state.level());
        } else if (gen == currentGen) {
            reason = "Current gen " + tier + " tier hero! Worth investing heavily.";
        } else if (gen >= currentGen - 1) {
            reason = "Still relevant " + tier + " tier hero. Upgrade to Lv" + targetLevel + ", "
                + targetStars + " stars recommended.";
        } else {
            reason = "Gen " + gen + " " + tier + " tier. Moderate investment, save for newer heroes.";
        }

        if (state.level() >= targetLevel && state.stars() >= targetStars) {
            reason = "At target level. " + tier + " tier, maintain and focus elsewhere.";
        }

        String heroClass = ref.troopClass().map(c -> c.displayName()).orElse("Unknown");
        return new HeroInvestment(name, heroClass, tier, gen, state.level(),
            Math.max(targetLevel, state.level()), state.stars(),
            Math.max(targetStars, state.stars()), rank, reason);
    }

    private static int[] targetFor(SpenderTier spender, int heroGen, int currentGen) {
        return switch (spender) {
            case WHALE, ORCA -> new int[]{80, 5};
            case DOLPHIN -> heroGen >= currentGen - 1 ? new int[]{70, 4} : new int[]{60, 3};
            case MINNOW  -> heroGen >= currentGen - 2 ? new int[]{60, 3} : new int[]{50, 2};
            case F2P     -> heroGen >= currentGen - 1 ? new int[]{50, 2} : new int[]{40, 1};
        };
    }
}
