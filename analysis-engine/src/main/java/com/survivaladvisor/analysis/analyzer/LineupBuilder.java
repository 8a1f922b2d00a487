package com.survivaladvisor.analysis.analyzer;

import com.survivaladvisor.analysis.lineup.GameMode;
import com.survivaladvisor.analysis.lineup.LineupTemplate;
import com.survivaladvisor.analysis.lineup.LineupTemplates;
import com.survivaladvisor.analysis.scoring.GenerationTimeline;
import com.survivaladvisor.analysis.scoring.HeroValueScorer;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.JoinerAdvice;
import com.survivaladvisor.common.model.LineupConfidence;
import com.survivaladvisor.common.model.LineupResult;
import com.survivaladvisor.common.model.LineupSlot;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationCategory;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;
import com.survivaladvisor.common.reference.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fills lineup templates from the owned roster and advises on rally joining.
 *
 * <p>Each slot is scored per candidate as {@code round(heroValue × 100) + preferenceBonus}.
 * Candidates are the owned preferred heroes plus every owned hero of the slot's troop
 * class. The bonus falls with preference rank: joiner slots start at 1000 so preference
 * always wins there, the lead slot at 100 and other slots at 75. Equal scores go to the
 * alphabetically first hero, and no hero fills two slots.
 */
@Component
@Order(3)
public class LineupBuilder implements RuleAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LineupBuilder.class);

    private static final int HIGH_PRIORITY = 4;

    private static final Map<Pattern, GameMode> QUESTION_MODES = new LinkedHashMap<>();

    static {
        QUESTION_MODES.put(Pattern.compile("bear trap"), GameMode.BEAR_TRAP);
        QUESTION_MODES.put(Pattern.compile("crazy joe"), GameMode.CRAZY_JOE);
        QUESTION_MODES.put(Pattern.compile("garrison"), GameMode.GARRISON);
        QUESTION_MODES.put(Pattern.compile("defen[cs]e"), GameMode.GARRISON);
        QUESTION_MODES.put(Pattern.compile("reinforce"), GameMode.RALLY_JOINER_DEFENSE);
        QUESTION_MODES.put(Pattern.compile("join.*attack"), GameMode.RALLY_JOINER_ATTACK);
        QUESTION_MODES.put(Pattern.compile("join.*rally"), GameMode.RALLY_JOINER_ATTACK);
        QUESTION_MODES.put(Pattern.compile("rally leader"), GameMode.RALLY_LEADER_INFANTRY);
        QUESTION_MODES.put(Pattern.compile("lead.*rally"), GameMode.RALLY_LEADER_INFANTRY);
        QUESTION_MODES.put(Pattern.compile("marksman"), GameMode.RALLY_LEADER_MARKSMAN);
        QUESTION_MODES.put(Pattern.compile("exploration"), GameMode.EXPLORATION);
        QUESTION_MODES.put(Pattern.compile("pve"), GameMode.EXPLORATION);
        QUESTION_MODES.put(Pattern.compile("frozen"), GameMode.EXPLORATION);
        QUESTION_MODES.put(Pattern.compile("svs"), GameMode.SVS_MARCH);
        QUESTION_MODES.put(Pattern.compile("field"), GameMode.SVS_MARCH);
    }

    private final HeroValueScorer scorer;
    private final ReferenceData referenceData;

    public LineupBuilder(HeroValueScorer scorer) {
        this.scorer = scorer;
        this.referenceData = scorer.referenceData();
    }

    @Override
    public List<RecommendationRecord> analyze(PlayerSnapshot snapshot) {
        log.info("[LineupBuilder] Analyzing heroes={}", snapshot.heroes().size());

        List<RecommendationRecord> records = new ArrayList<>();
        if (snapshot.priorities().rally() >= 3) {
            records.add(joinerRecord(joinerAdvice(snapshot, true), true));
        }
        if (snapshot.priorities().castle() >= 3) {
            records.add(joinerRecord(joinerAdvice(snapshot, false), false));
        }

        for (GameMode mode : GameMode.values()) {
            if (mode.isJoinerMode() || mode.priorityFor(snapshot.priorities()) < HIGH_PRIORITY) {
                continue;
            }
            LineupResult lineup = buildLineup(mode, snapshot);
            if (lineup.confidence() == LineupConfidence.LOW) {
                records.add(lineupGapRecord(mode, lineup));
            }
        }

        records.sort(Comparator.comparingInt(RecommendationRecord::priority));
        return records;
    }

    @Override
    public String analyzerName() {
        return "LineupBuilder";
    }

    @Override
    public RuleHandler handler() {
        return RuleHandler.LINEUP_BUILDER;
    }

    // ── lineup construction ────────────────────────────────────────────────

    public LineupResult buildLineup(GameMode mode, PlayerSnapshot snapshot) {
        LineupTemplate template = LineupTemplates.forMode(mode);
        int currentGen = GenerationTimeline.currentGeneration(snapshot.stateAgeDays());
        Set<String> used = new HashSet<>();
        List<LineupSlot> slots = new ArrayList<>();
        int filledCritical = 0;

        List<LineupTemplate.Slot> templateSlots = template.slots();
        for (int i = 0; i < templateSlots.size(); i++) {
            LineupTemplate.Slot slot = templateSlots.get(i);
            if (slot.isFiller()) {
                slots.add(fillFiller(slot, snapshot, used, currentGen));
                continue;
            }
            Optional<String> best = bestCandidate(slot, i == 0, snapshot, used, currentGen);
            if (best.isPresent()) {
                String hero = best.get();
                used.add(hero);
                filledCritical++;
                slots.add(new LineupSlot(slot.position(), slot.role(), hero, true,
                    "Lv" + snapshot.heroes().get(hero).level()));
            } else {
                slots.add(new LineupSlot(slot.position(), slot.role(), slot.preferred().get(0), false, "Not owned"));
            }
        }

        int critical = Math.max(1, template.criticalSlots().size());
        LineupConfidence confidence;
        if (filledCritical == critical) {
            confidence = LineupConfidence.HIGH;
        } else if (filledCritical >= critical * 0.5) {
            confidence = LineupConfidence.MEDIUM;
        } else {
            confidence = LineupConfidence.LOW;
        }

        Set<String> toGet = new LinkedHashSet<>();
        for (LineupTemplate.Slot slot : template.criticalSlots()) {
            String first = slot.preferred().get(0);
            if (!snapshot.owns(first)) {
                toGet.add(first);
            }
        }

        log.debug("[LineupBuilder] Built mode={} confidence={} filled={}/{}",
            mode.key(), confidence, filledCritical, critical);
        return new LineupResult(mode.key(), mode.displayName(), slots, template.troopRatio(), template.notes(),
            confidence, List.copyOf(toGet));
    }

    private Optional<String> bestCandidate(LineupTemplate.Slot slot, boolean lead, PlayerSnapshot snapshot,
                                           Set<String> used, int currentGen) {
        Map<String, Integer> points = new LinkedHashMap<>();
        List<String> preferred = slot.preferred();
        for (int idx = 0; idx < preferred.size(); idx++) {
            String name = preferred.get(idx);
            if (snapshot.owns(name) && !used.contains(name)) {
                points.put(name, baseScore(name, snapshot, currentGen) + preferenceBonus(slot, lead, idx));
            }
        }
        if (slot.troopClass() != null) {
            for (String name : snapshot.heroes().keySet()) {
                if (!used.contains(name) && !points.containsKey(name)
                        && referenceData.hero(name).heroClass() == slot.troopClass()) {
                    points.put(name, baseScore(name, snapshot, currentGen));
                }
            }
        }
        return points.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()))
            .map(Map.Entry::getKey)
            .findFirst();
    }

    private LineupSlot fillFiller(LineupTemplate.Slot slot, PlayerSnapshot snapshot, Set<String> used, int currentGen) {
        Optional<String> best = snapshot.heroes().keySet().stream()
            .filter(name -> !used.contains(name))
            .min(Comparator.comparingInt((String name) -> -baseScore(name, snapshot, currentGen))
                .thenComparing(Comparator.naturalOrder()));
        if (best.isEmpty()) {
            return new LineupSlot(slot.position(), slot.role(), "Any hero", false, "Filler slot");
        }
        String hero = best.get();
        used.add(hero);
        return new LineupSlot(slot.position(), slot.role(), hero, true,
            "Lv" + snapshot.heroes().get(hero).level() + " (filler)");
    }

    private int baseScore(String name, PlayerSnapshot snapshot, int currentGen) {
        return (int) Math.round(scorer.value(name, snapshot.heroes().get(name), currentGen) * 100);
    }

    private static int preferenceBonus(LineupTemplate.Slot slot, boolean lead, int idx) {
        if (slot.joinerSlot()) {
            return Math.max(200, 1000 - idx * 100);
        }
        return lead ? 100 - idx * 10 : 75 - idx * 5;
    }

    // ── joiners ────────────────────────────────────────────────────────────

    /** Best owned joiner for attack (Jessie, then Jeronimo) or defense (Sergey, then Natalia) rallies. */
    public JoinerAdvice joinerAdvice(PlayerSnapshot snapshot, boolean attack) {
        List<String> joiners = attack
            ? List.of(HeroAnalyzer.ATTACK_JOINER, "Jeronimo")
            : List.of(HeroAnalyzer.DEFENSE_JOINER, "Natalia");
        String skillName = attack ? "Stand of Arms" : "Defenders' Edge";
        String effect = attack ? "+25% DMG dealt" : "-20% DMG taken";
        String side = attack ? "attack" : "defense";

        for (String joiner : joiners) {
            HeroState state = snapshot.heroes().get(joiner);
            if (state == null) {
                continue;
            }
            int skill = state.joinerSkillLevel();
            return new JoinerAdvice(joiner, true, skill,
                "Use " + joiner + " in slot 1. Skill at L" + skill + "/5.",
                skill < HeroState.MAX_SKILL ? "Max " + joiner + "'s expedition skill" : "Ready to join!",
                "ONLY slot 1 hero's top-right skill (" + skillName + ": " + effect + ") applies when joining!");
        }

        return new JoinerAdvice(null, false, 0,
            "No good " + side + " joiner owned.",
            "REMOVE ALL HEROES when joining " + side + " rallies. Send troops only!",
            "Sending no heroes is BETTER than contributing a bad skill that bumps out a good one.");
    }

    private static RecommendationRecord joinerRecord(JoinerAdvice advice, boolean attack) {
        String ruleId = attack ? "joiner_attack" : "joiner_defense";
        String[] tags = attack ? new String[]{"rally", "joiner"} : new String[]{"garrison", "joiner"};
        if (!advice.owned()) {
            return RecommendationRecord.rule(2, RecommendationCategory.LINEUP, advice.action(), null,
                advice.recommendation() + " " + advice.criticalNote(), "N/A", ruleId, tags);
        }
        return RecommendationRecord.rule(3, RecommendationCategory.LINEUP, advice.recommendation(), advice.hero(),
            advice.criticalNote(), "N/A", ruleId, tags);
    }

    private static RecommendationRecord lineupGapRecord(GameMode mode, LineupResult lineup) {
        String missing = String.join(", ", lineup.recommendedToGet());
        String reason = "Most key slots for " + mode.displayName() + " are empty."
            + (missing.isEmpty() ? "" : " Key heroes to acquire: " + missing + ".");
        return RecommendationRecord.rule(3, RecommendationCategory.LINEUP,
            "Strengthen your " + mode.displayName() + " lineup", missing.isEmpty() ? null : missing,
            reason, "Hero shards from events, packs, or VIP shop", "lineup_gap_" + mode.key(),
            "lineup", mode.key());
    }

    // ── question routing ───────────────────────────────────────────────────

    /** Lineup for the first game mode the question mentions, if any. */
    public Optional<LineupResult> lineupForQuestion(String question, PlayerSnapshot snapshot) {
        if (question == null) {
            return Optional.empty();
        }
        String lower = question.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, GameMode> e : QUESTION_MODES.entrySet()) {
            if (e.getKey().matcher(lower).find()) {
                return Optional.of(buildLineup(e.getValue(), snapshot));
            }
        }
        return Optional.empty();
    }
}
