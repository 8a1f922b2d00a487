package com.survivaladvisor.orchestrator.service;

import com.survivaladvisor.analysis.analyzer.HeroAnalyzer;
import com.survivaladvisor.common.model.LineupResult;
import com.survivaladvisor.common.model.LineupSlot;
import com.survivaladvisor.common.model.Milestone;
import com.survivaladvisor.common.model.PhaseInfo;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.TroopClass;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Natural-language answers for questions the rule analyzers handle.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class RuleAnswerBuilder {

    static final String NO_LINEUP_MATCH =
        "Chief, I'm not sure which lineup you're asking about. Try asking about Bear Trap, Crazy Joe, "
        + "Garrison defense, SvS marches, or rally joining - I can give you specific hero and troop "
        + "recommendations for each.";

    static final String NO_HEROES =
        "Chief, I need more info about your heroes to give specific upgrade advice. "
        + "Add some heroes to your tracker first.";

    static final String GEAR =
        "Chief, for gear upgrades, focus on your main class first. "
        + "Each tier jump is a significant power boost to your settlement.";

    static final String PRIORITY =
        "Chief, here's where to commit your resources for maximum efficiency right now.";

    static final String GENERAL =
        "Hey Chief! I can help with things like hero lineups, upgrade priorities, SvS strategy, gear "
        + "recommendations, rally compositions, and pretty much anything else about Whiteout Survival. "
        + "What's on your mind?";

    /** Last resort when neither the AI collaborator nor the rules produced an answer. */
    public static final String STATIC_DEFAULT =
        "Hey Chief! I can help with hero lineups, upgrade priorities, SvS strategy, gear "
        + "recommendations, and rally compositions. What specifically would you like to know?";

    private RuleAnswerBuilder() {}

    public static String lineup(LineupResult lineup) {
        String heroes = lineup.heroes().stream()
            .map(RuleAnswerBuilder::slotLabel)
            .collect(Collectors.joining(", "));

        List<String> troops = new ArrayList<>();
        for (TroopClass troop : TroopClass.values()) {
            int pct = lineup.troopRatio().getOrDefault(troop, 0);
            if (pct > 0) {
                troops.add(pct + "% " + troop.displayName());
            }
        }

        return "Chief, for " + lineup.modeName() + ":\n\n"
            + "Run **" + heroes + "** in that order.\n\n"
            + "Troop composition: " + String.join(" / ", troops) + "\n\n"
            + lineup.notes();
    }

    public static String heroUpgrade(List<RecommendationRecord> heroRecords) {
        if (heroRecords.isEmpty()
                || heroRecords.stream().anyMatch(r -> HeroAnalyzer.NO_HEROES_RULE_ID.equals(r.ruleId()))) {
            return NO_HEROES;
        }
        String target = heroRecords.get(0).target();
        String hero = (target == null || target.isBlank()) ? "your top hero" : target;
        return "Chief, based on your roster and priorities, I'd focus on promoting " + hero
            + " first. That's your highest efficiency play right now.";
    }

    public static String phase(PhaseInfo info) {
        Milestone next = info.nextMilestone();
        String nextName = next != null ? next.name() : "endgame";
        return "Chief, you're in " + info.name() + ". Your route to " + nextName
            + " should be your main focus - don't get distracted by side upgrades.";
    }

    private static String slotLabel(LineupSlot slot) {
        String hero = slot.hero() != null ? slot.hero() : "Any hero";
        return hero + " (" + slot.role() + ")";
    }
}
