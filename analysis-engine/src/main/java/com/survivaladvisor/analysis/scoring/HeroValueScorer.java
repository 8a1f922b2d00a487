package com.survivaladvisor.analysis.scoring;

import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.reference.HeroReference;
import com.survivaladvisor.common.reference.ReferenceData;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Single hero valuation shared by the hero analyzer and the lineup builder:
 * {@code tierScore × generationRelevance + skillScore}.
 *
 * <p>{@code skillScore} grows linearly with owned skill levels up to {@value #MAX_SKILL_SCORE}
 * at all six skills maxed, so skills separate heroes of equal tier without overtaking tier.
 */
@Component
public class HeroValueScorer {

    public static final double MAX_SKILL_SCORE = 0.2;

    private static final int MAX_TOTAL_SKILL_LEVELS = 6 * HeroState.MAX_SKILL;

    private final ReferenceData referenceData;

    public HeroValueScorer(ReferenceData referenceData) {
        this.referenceData = referenceData;
    }

    public double value(String heroName, HeroState state, int currentGeneration) {
        return tierRelevance(heroName, currentGeneration) + skillScore(state);
    }

    /** Tier score weighted by generation relevance, without the skill component. */
    public double tierRelevance(String heroName, int currentGeneration) {
        HeroReference ref = referenceData.hero(heroName);
        return ref.tier().score() * relevance(heroName, currentGeneration);
    }

    public double relevance(String heroName, int currentGeneration) {
        HeroReference ref = referenceData.hero(heroName);
        return GenerationTimeline.relevance(ref.generation(), currentGeneration, ref.tier());
    }

    public double skillScore(HeroState state) {
        if (state == null) {
            return 0.0;
        }
        return MAX_SKILL_SCORE * Math.min(1.0, (double) state.totalSkillLevels() / MAX_TOTAL_SKILL_LEVELS);
    }

    /** Owned hero names, most valuable first; equal values in name order. */
    public List<String> rankOwned(PlayerSnapshot snapshot) {
        int gen = GenerationTimeline.currentGeneration(snapshot.stateAgeDays());
        Map<String, HeroState> heroes = snapshot.heroes();
        return heroes.keySet().stream()
            .sorted(Comparator.comparingDouble((String name) -> value(name, heroes.get(name), gen))
                .reversed()
                .thenComparing(Comparator.naturalOrder()))
            .toList();
    }

    public ReferenceData referenceData() {
        return referenceData;
    }
}
